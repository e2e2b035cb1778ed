package com.traceharvest.service.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.traceharvest.exception.TraceHarvestException;
import com.traceharvest.model.CollectionArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Writes a whole artifact as one pretty-printed JSON document.
 */
@Slf4j
@Component
public class ArtifactWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern UNSAFE_LABEL_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ArtifactWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path write(CollectionArtifact artifact, Path outputDir, String experimentName) {
        Path target = outputDir.resolve(fileName(experimentName));
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(target.toFile(), artifact);
        } catch (IOException e) {
            throw new TraceHarvestException("Failed to write trace artifact to " + target, e);
        }
        log.info("Trace collection written to {}", target);
        return target;
    }

    String fileName(String experimentName) {
        String timestamp = FILE_TIMESTAMP.format(clock.instant());
        String label = sanitize(experimentName);
        return label.isEmpty()
                ? "skywalking_traces_" + timestamp + ".json"
                : label + "_skywalking_traces_" + timestamp + ".json";
    }

    static String sanitize(String experimentName) {
        if (experimentName == null) {
            return "";
        }
        return UNSAFE_LABEL_CHARS.matcher(experimentName.trim()).replaceAll("_");
    }
}
