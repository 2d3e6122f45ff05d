/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.capture;

import io.clipsense4j.core.api.model.ContentType;
import java.time.Instant;
import java.util.UUID;

/**
 * A record ready to be stored. Child records reference their parent through
 * {@code parentEntryId}; split and primary records have none.
 *
 * @param metadata metadata JSON, empty when there is nothing to record
 */
public record ClipboardRecord(
        UUID id,
        String content,
        ContentType contentType,
        Instant timestamp,
        String sourceApp,
        String metadata,
        UUID parentEntryId) {

    public boolean isExtracted() {
        return parentEntryId != null;
    }
}
