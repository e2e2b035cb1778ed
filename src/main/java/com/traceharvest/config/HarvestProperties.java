package com.traceharvest.config;

import com.traceharvest.model.CollectionRequest;
import com.traceharvest.model.QueryOrder;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {

    private String backendUrl = "http://127.0.0.1:30005";
    private String graphqlPath = "/graphql";

    // 0 = collect everything the backend reports
    private int size = 0;
    private double lookbackHours = 24;
    private long minDurationMs = 1;
    private int concurrency = 16;
    private QueryOrder queryOrder = QueryOrder.BY_START_TIME;
    private int pageSize = 200;

    private String experimentName;
    private String outputDir = "trace_data";
    private boolean runOnStartup = false;

    private Http http = new Http();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration backoffStep = Duration.ofSeconds(3);
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    public String getGraphqlEndpoint() {
        String base = backendUrl.endsWith("/")
                ? backendUrl.substring(0, backendUrl.length() - 1)
                : backendUrl;
        return base + graphqlPath;
    }

    public CollectionRequest toCollectionRequest() {
        return CollectionRequest.builder()
                .size(size)
                .lookbackHours(lookbackHours)
                .minDurationMs(minDurationMs)
                .concurrency(concurrency)
                .queryOrder(queryOrder)
                .pageSize(pageSize)
                .experimentName(experimentName)
                .build();
    }
}
