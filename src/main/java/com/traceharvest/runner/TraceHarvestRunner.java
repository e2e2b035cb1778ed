package com.traceharvest.runner;

import com.traceharvest.config.HarvestProperties;
import com.traceharvest.exception.TraceHarvestException;
import com.traceharvest.model.CollectionArtifact;
import com.traceharvest.model.CollectionRequest;
import com.traceharvest.service.artifact.ArtifactWriter;
import com.traceharvest.service.collection.CollectionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * One collection run at startup with the configured parameters.
 * A failed run propagates and stops the application with a non-zero exit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "harvest.run-on-startup", havingValue = "true")
public class TraceHarvestRunner implements CommandLineRunner {

    private final CollectionCoordinator coordinator;
    private final ArtifactWriter artifactWriter;
    private final HarvestProperties harvestProperties;

    @Override
    public void run(String... args) {
        CollectionRequest request = harvestProperties.toCollectionRequest();
        try {
            CollectionArtifact artifact = coordinator.collect(request);
            artifactWriter.write(artifact, Paths.get(harvestProperties.getOutputDir()), request.getExperimentName());
        } catch (TraceHarvestException e) {
            log.error("Trace collection failed: {}", e.getMessage());
            throw e;
        }
    }
}
