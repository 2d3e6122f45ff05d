/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

/** Thrown when a metadata document cannot be written as JSON. */
public class MetadataCodecException extends RuntimeException {
    public MetadataCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
