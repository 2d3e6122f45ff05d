/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

/** An independent record produced when a payload is split (environment blocks). */
public record SplitEntry(String content, ContentType contentType, String metadataJson) {}
