package com.traceharvest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Optional HTTP proxy placed in front of the tracing backend.
 */
@Data
@Component
@ConfigurationProperties(prefix = "harvest.proxy")
public class ProxyProperties {
    private boolean enabled;
    private String host;
    private int port;
}
