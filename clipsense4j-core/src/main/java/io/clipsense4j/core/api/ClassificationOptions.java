/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api;

/**
 * Per-call switches.
 *
 * @param extractContent    run every family and emit derived child records
 * @param skipApiKeys       drop records whose type is {@code apiKey} before they are stored
 * @param maxExtractedItems upper bound on derived child records
 */
public record ClassificationOptions(boolean extractContent, boolean skipApiKeys, int maxExtractedItems) {
    public static final int DEFAULT_MAX_EXTRACTED_ITEMS = 20;

    public ClassificationOptions {
        if (maxExtractedItems < 0) {
            throw new IllegalArgumentException("maxExtractedItems must be >= 0");
        }
    }

    public static ClassificationOptions defaults() {
        return new ClassificationOptions(true, false, DEFAULT_MAX_EXTRACTED_ITEMS);
    }

    public static ClassificationOptions primaryOnly() {
        return new ClassificationOptions(false, false, DEFAULT_MAX_EXTRACTED_ITEMS);
    }

    public ClassificationOptions withSkipApiKeys(boolean skip) {
        return new ClassificationOptions(extractContent, skip, maxExtractedItems);
    }
}
