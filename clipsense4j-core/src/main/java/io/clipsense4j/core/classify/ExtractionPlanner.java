/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.classify;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.ExtractedItem;
import io.clipsense4j.core.metadata.MetadataCodec;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns detections into child records. Families are interleaved round-robin so a low cap
 * still keeps one item of each family; a detection covering the whole payload is not a
 * child of it.
 */
final class ExtractionPlanner {
    static final List<ContentType> EXTRACTABLE = List.of(
            ContentType.EMAIL,
            ContentType.URL,
            ContentType.PHONE_NUMBER,
            ContentType.IP_ADDRESS,
            ContentType.UUID,
            ContentType.HASH,
            ContentType.API_KEY,
            ContentType.JWT,
            ContentType.ENV_VAR,
            ContentType.FILE_PATH,
            ContentType.SHELL_COMMAND);

    private final MetadataCodec codec;

    ExtractionPlanner(MetadataCodec codec) {
        this.codec = codec;
    }

    List<ExtractedItem> plan(Map<ContentType, List<? extends Detection>> found, String subject, int limit) {
        if (limit <= 0) return List.of();
        Set<String> seen = new HashSet<>();
        List<Deque<Detection>> queues = new ArrayList<>();
        for (ContentType family : EXTRACTABLE) {
            Deque<Detection> queue = new ArrayDeque<>();
            for (Detection d : found.getOrDefault(family, List.of())) {
                if (coversWhole(d, subject)) continue;
                if (seen.add(family.wireName() + ':' + d.value().toLowerCase(Locale.ROOT))) queue.add(d);
            }
            if (!queue.isEmpty()) queues.add(queue);
        }

        List<ExtractedItem> out = new ArrayList<>();
        while (!queues.isEmpty() && out.size() < limit) {
            Iterator<Deque<Detection>> it = queues.iterator();
            while (it.hasNext() && out.size() < limit) {
                Deque<Detection> queue = it.next();
                out.add(toItem(queue.poll()));
                if (queue.isEmpty()) it.remove();
            }
        }
        return out;
    }

    private ExtractedItem toItem(Detection d) {
        String json = codec.serialize(new MetadataAssembler().add(d).build());
        return new ExtractedItem(d.value(), d.family(), json);
    }

    private static boolean coversWhole(Detection d, String subject) {
        if (d.value().equals(subject)) return true;
        return d.span().start() == 0 && d.span().end() == subject.length();
    }
}
