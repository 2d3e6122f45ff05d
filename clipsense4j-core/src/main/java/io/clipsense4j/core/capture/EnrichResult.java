/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.capture;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.clipsense4j.core.api.model.ClassificationOutput;
import java.util.List;
import java.util.Optional;

/**
 * Records produced for one capture.
 *
 * @param skippedApiKeys records of type {@code apiKey} dropped because the caller asked to
 * @param classification absent for images and screenshots
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "records is an immutable copy")
public record EnrichResult(List<ClipboardRecord> records, int skippedApiKeys, ClassificationOutput classification) {
    public EnrichResult {
        records = List.copyOf(records);
    }

    public Optional<ClassificationOutput> classificationOutput() {
        return Optional.ofNullable(classification);
    }
}
