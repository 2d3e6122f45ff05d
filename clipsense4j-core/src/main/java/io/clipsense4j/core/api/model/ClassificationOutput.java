/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import java.util.List;

/**
 * Result of classifying one payload. {@code splitEntries} and {@code extractedItems} are
 * never both non-empty.
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "lists are immutable copies")
public record ClassificationOutput(
        ContentType primaryType,
        double confidence,
        String metadataJson,
        MetadataDocument metadata,
        DecodeResult decoded,
        List<SplitEntry> splitEntries,
        List<ExtractedItem> extractedItems) {

    public ClassificationOutput {
        splitEntries = List.copyOf(splitEntries);
        extractedItems = List.copyOf(extractedItems);
        if (!splitEntries.isEmpty() && !extractedItems.isEmpty()) {
            throw new IllegalArgumentException("split entries and extracted items are mutually exclusive");
        }
    }

    public static ClassificationOutput unknown(String text) {
        return new ClassificationOutput(
                ContentType.UNKNOWN, 0.0, "", MetadataDocument.empty(), DecodeResult.none(text), List.of(), List.of());
    }

    public boolean isSplit() {
        return !splitEntries.isEmpty();
    }
}
