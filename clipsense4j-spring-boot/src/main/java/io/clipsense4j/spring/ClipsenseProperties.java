/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.spring;

import io.clipsense4j.core.api.ClassificationOptions;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.detect.PathProbe;
import io.clipsense4j.core.encoding.EncodingResolver;
import io.clipsense4j.core.metadata.FamilyMaskCache;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "clipsense4j")
public class ClipsenseProperties {

    @Setter
    private boolean enabled = true;

    /** Run every detector and emit child records for secondary detections. */
    @Setter
    private boolean extractContent = true;

    @Setter
    private boolean skipApiKeys = false;

    @Setter
    private int maxDecodeRounds = EncodingResolver.DEFAULT_MAX_ROUNDS;

    @Setter
    private int maxExtractedItems = ClassificationOptions.DEFAULT_MAX_EXTRACTED_ITEMS;

    /** Enabled families; empty means all of them. */
    private List<ContentType> detectors = new ArrayList<>();

    private Metadata metadata = new Metadata();
    private FilePaths filePaths = new FilePaths();
    private Reporter reporter = new Reporter();

    public List<ContentType> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<ContentType> detectors) {
        this.detectors = new ArrayList<>(Objects.requireNonNullElse(detectors, List.of()));
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = (metadata == null) ? new Metadata() : metadata;
    }

    public void setFilePaths(FilePaths filePaths) {
        this.filePaths = (filePaths == null) ? new FilePaths() : filePaths;
    }

    public void setReporter(Reporter reporter) {
        this.reporter = (reporter == null) ? new Reporter() : reporter;
    }

    public ClassificationOptions toOptions() {
        return new ClassificationOptions(extractContent, skipApiKeys, Math.max(0, maxExtractedItems));
    }

    // ---- nested: metadata ----
    public static final class Metadata {
        @Setter
        @Getter
        private int cacheCapacity = FamilyMaskCache.DEFAULT_CAPACITY;
    }

    // ---- nested: file-paths ----
    public static final class FilePaths {
        @Setter
        @Getter
        private Duration statTimeout = PathProbe.DEFAULT_TIMEOUT;
    }

    // ---- nested: reporter ----
    public static final class Reporter {
        @Setter
        @Getter
        private int capacity = 200;
    }
}
