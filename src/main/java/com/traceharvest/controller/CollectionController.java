package com.traceharvest.controller;

import com.traceharvest.config.HarvestProperties;
import com.traceharvest.factory.TraceBackendEngineFactory;
import com.traceharvest.model.CollectionArtifact;
import com.traceharvest.model.CollectionMetadata;
import com.traceharvest.model.CollectionOverrides;
import com.traceharvest.model.CollectionRequest;
import com.traceharvest.model.CollectionResponse;
import com.traceharvest.model.SpanHierarchy;
import com.traceharvest.service.artifact.ArtifactWriter;
import com.traceharvest.service.collection.CollectionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/collections")
@RequiredArgsConstructor
public class CollectionController {

    private final CollectionCoordinator coordinator;
    private final ArtifactWriter artifactWriter;
    private final TraceBackendEngineFactory engineFactory;
    private final HarvestProperties harvestProperties;

    @PostMapping
    public ResponseEntity<CollectionResponse> collect(@RequestBody(required = false) CollectionOverrides overrides) {
        CollectionRequest request = harvestProperties.toCollectionRequest();
        if (overrides != null) {
            request = overrides.applyTo(request);
        }

        log.info("=== COLLECTION REQUEST using {} ===", engineFactory.getEngine().getEngineType());
        log.info("Size: {}, lookback: {}h, workers: {}",
                request.getSize(), request.getLookbackHours(), request.getConcurrency());

        CollectionArtifact artifact = coordinator.collect(request);
        Path written = artifactWriter.write(artifact,
                Paths.get(harvestProperties.getOutputDir()), request.getExperimentName());

        CollectionMetadata metadata = artifact.getMetadata();
        return ResponseEntity.ok(CollectionResponse.builder()
                .artifactPath(written.toString())
                .requested(request.getSize())
                .discovered(metadata.getDiscoveredTraces())
                .collected(metadata.getCollectedTraces())
                .failed(metadata.getFailedTraces())
                .empty(metadata.getEmptyTraces())
                .availableTotal(metadata.getAvailableTotal())
                .servicesDiscovered(metadata.getServicesDiscovered())
                .build());
    }

    @GetMapping("/traces/{traceId}")
    public ResponseEntity<SpanHierarchy> getTrace(@PathVariable String traceId) {
        SpanHierarchy hierarchy = coordinator.rebuildTrace(traceId);
        if (hierarchy.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(hierarchy);
    }

    @GetMapping("/backend/status")
    public ResponseEntity<Map<String, Object>> backendStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("engine", engineFactory.getEngine().getEngineType());
        status.put("endpoint", harvestProperties.getGraphqlEndpoint());
        status.put("connected", engineFactory.getEngine().testConnection());
        return ResponseEntity.ok(status);
    }
}
