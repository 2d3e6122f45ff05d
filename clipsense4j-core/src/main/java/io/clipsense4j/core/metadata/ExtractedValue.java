/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

import io.clipsense4j.core.api.model.ContentType;

/** One value read back from a metadata document, with a short label for display. */
public record ExtractedValue(ContentType type, String value, String displayValue) {
    public ExtractedValue(ContentType type, String value) {
        this(type, value, value);
    }
}
