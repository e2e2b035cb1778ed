package com.traceharvest.config;

import com.traceharvest.client.GraphQlQueryClient;
import com.traceharvest.client.QueryClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class BackendClientConfiguration {

    private final HarvestProperties harvestProperties;
    private final ProxyProperties proxyProperties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient backendRestClient(RestClient.Builder builder) {
        HarvestProperties.Http http = harvestProperties.getHttp();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(http.getConnectTimeout());
        requestFactory.setReadTimeout(http.getReadTimeout());

        if (proxyProperties.isEnabled()) {
            log.info("Routing backend requests through proxy {}:{}",
                    proxyProperties.getHost(), proxyProperties.getPort());
            requestFactory.setProxy(new Proxy(Proxy.Type.HTTP,
                    new InetSocketAddress(proxyProperties.getHost(), proxyProperties.getPort())));
        }

        return builder
                .requestFactory(requestFactory)
                .defaultHeader("User-Agent", "TraceHarvest/1.0")
                .build();
    }

    @Bean
    public QueryClient queryClient(RestClient backendRestClient) {
        HarvestProperties.Http http = harvestProperties.getHttp();
        log.info("Using tracing backend endpoint: {}", harvestProperties.getGraphqlEndpoint());
        return new GraphQlQueryClient(
                backendRestClient,
                harvestProperties.getGraphqlEndpoint(),
                http.getMaxRetries(),
                http.getBackoffStep(),
                http.getMaxBackoff());
    }
}
