/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.capture;

import io.clipsense4j.core.api.model.ContentType;

public enum CaptureKind {
    TEXT(ContentType.TEXT),
    IMAGE(ContentType.IMAGE),
    SCREENSHOT(ContentType.SCREENSHOT);

    private final ContentType contentType;

    CaptureKind(ContentType contentType) {
        this.contentType = contentType;
    }

    /** Stored type for binary captures, which are never classified. */
    public ContentType contentType() {
        return contentType;
    }

    public boolean isBinary() {
        return this != TEXT;
    }
}
