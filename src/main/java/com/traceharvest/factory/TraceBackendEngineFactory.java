package com.traceharvest.factory;

import com.traceharvest.engine.TraceBackendEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import jakarta.annotation.PostConstruct;

@Slf4j
@Component
@RequiredArgsConstructor
public class TraceBackendEngineFactory {

    private final TraceBackendEngine engine;  // chosen by @ConditionalOnProperty on harvest.engine.type

    @PostConstruct
    public void init() {
        log.info("TraceHarvest engine initialized: {}", engine.getEngineType());
    }

    public TraceBackendEngine getEngine() {
        return engine;
    }
}
