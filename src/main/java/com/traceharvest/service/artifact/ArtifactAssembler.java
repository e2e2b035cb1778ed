package com.traceharvest.service.artifact;

import com.traceharvest.config.HarvestProperties;
import com.traceharvest.model.CollectionArtifact;
import com.traceharvest.model.CollectionMetadata;
import com.traceharvest.model.CollectionRequest;
import com.traceharvest.model.RunTally;
import com.traceharvest.model.TraceRecord;
import com.traceharvest.service.statistics.TraceStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Shapes retained traces and run metadata into the persisted document.
 * No I/O happens here.
 */
@Component
@RequiredArgsConstructor
public class ArtifactAssembler {

    private final HarvestProperties harvestProperties;
    private final TraceStatisticsService statisticsService;
    private final Clock clock;

    public CollectionArtifact assemble(List<TraceRecord> traces, CollectionRequest parameters, RunTally tally) {
        CollectionMetadata metadata = CollectionMetadata.builder()
                .generatedAt(clock.instant().toString())
                .lookbackHours(parameters.getLookbackHours())
                .requestedTraceLimit(parameters.getSize())
                .minTraceDurationMs(parameters.getMinDurationMs())
                .queryOrder(parameters.getQueryOrder())
                .concurrency(parameters.getConcurrency())
                .discoveredTraces(tally.getDiscovered())
                .collectedTraces(traces.size())
                .failedTraces(tally.getFailed())
                .emptyTraces(tally.getEmpty())
                .availableTotal(tally.getAvailableTotal())
                .servicesDiscovered(List.copyOf(tally.getServicesDiscovered()))
                .experimentName(parameters.getExperimentName())
                .backendBaseUrl(harvestProperties.getBackendUrl())
                .backendGraphqlEndpoint(harvestProperties.getGraphqlEndpoint())
                .statistics(statisticsService.summarize(traces))
                .build();

        return new CollectionArtifact(metadata, List.copyOf(traces));
    }
}
