package com.traceharvest;

import com.traceharvest.config.HarvestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TraceHarvest - distributed trace retrieval and span hierarchy reconstruction
 */
@SpringBootApplication
@EnableConfigurationProperties(HarvestProperties.class)
public class TraceHarvestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceHarvestApplication.class, args);
    }
}
