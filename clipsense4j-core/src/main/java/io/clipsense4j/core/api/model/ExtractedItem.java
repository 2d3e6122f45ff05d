/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

/** A derived child record; stored with a reference to the primary record. */
public record ExtractedItem(String content, ContentType contentType, String metadataJson) {}
