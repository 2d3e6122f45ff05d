/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

/**
 * One classification outcome, used for metrics. {@code confidence} is the confidence of
 * the primary classification the record belongs to.
 */
public record Finding(ContentType type, Role role, double confidence) {

    public enum Role {
        /** The primary type of a captured payload. */
        PRIMARY,
        /** A derived child record. */
        EXTRACTED,
        /** One record of a split environment block. */
        SPLIT
    }
}
