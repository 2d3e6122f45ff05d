/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.capture;

import io.clipsense4j.core.api.ClassificationOptions;
import io.clipsense4j.core.api.model.ClassificationOutput;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.ExtractedItem;
import io.clipsense4j.core.api.model.SplitEntry;
import io.clipsense4j.core.classify.ContentClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a captured payload into storable records: either one enriched record plus its
 * children, or the independent records of a split environment block. Images and
 * screenshots pass through unclassified.
 *
 * <p>With {@code skipApiKeys} every record typed {@code apiKey} is dropped. When that is
 * the primary record its children are dropped with it, so no child points at a record
 * that was never stored.</p>
 */
@Slf4j
public final class CaptureEnricher {
    private final ContentClassifier classifier;
    private final Supplier<UUID> ids;

    public CaptureEnricher(ContentClassifier classifier) {
        this(classifier, UUID::randomUUID);
    }

    public CaptureEnricher(ContentClassifier classifier, Supplier<UUID> ids) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public EnrichResult enrich(CapturedItem item, ClassificationOptions options) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(options, "options");
        if (item.kind().isBinary()) {
            ClipboardRecord record = new ClipboardRecord(
                    item.id(), item.content(), item.kind().contentType(), item.timestamp(), item.sourceApp(), "", null);
            return new EnrichResult(List.of(record), 0, null);
        }

        ClassificationOutput out = classifier.classify(item.content(), options);
        return out.isSplit() ? splitRecords(item, out, options) : enrichedRecords(item, out, options);
    }

    private EnrichResult splitRecords(CapturedItem item, ClassificationOutput out, ClassificationOptions options) {
        List<ClipboardRecord> records = new ArrayList<>();
        int skipped = 0;
        for (SplitEntry e : out.splitEntries()) {
            if (options.skipApiKeys() && e.contentType() == ContentType.API_KEY) {
                skipped++;
                continue;
            }
            records.add(new ClipboardRecord(
                    ids.get(), e.content(), e.contentType(), item.timestamp(), item.sourceApp(), e.metadataJson(), null));
        }
        return new EnrichResult(records, skipped, out);
    }

    private EnrichResult enrichedRecords(CapturedItem item, ClassificationOutput out, ClassificationOptions options) {
        boolean skip = options.skipApiKeys();
        if (skip && out.primaryType() == ContentType.API_KEY) {
            int children = (int) out.extractedItems().stream()
                    .filter(i -> i.contentType() == ContentType.API_KEY)
                    .count();
            log.debug("Dropping API key capture {} and its {} extracted records", item.id(), out.extractedItems().size());
            return new EnrichResult(List.of(), 1 + children, out);
        }

        List<ClipboardRecord> records = new ArrayList<>();
        records.add(new ClipboardRecord(
                item.id(), item.content(), out.primaryType(), item.timestamp(), item.sourceApp(), out.metadataJson(), null));
        int skipped = 0;
        for (ExtractedItem child : out.extractedItems()) {
            if (skip && child.contentType() == ContentType.API_KEY) {
                skipped++;
                continue;
            }
            records.add(new ClipboardRecord(
                    ids.get(),
                    child.content(),
                    child.contentType(),
                    item.timestamp(),
                    item.sourceApp(),
                    child.metadataJson(),
                    item.id()));
        }
        return new EnrichResult(records, skipped, out);
    }
}
