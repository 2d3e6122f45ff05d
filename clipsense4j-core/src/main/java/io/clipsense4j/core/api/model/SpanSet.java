/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Spans already claimed by an earlier detector. Later detectors drop any detection that
 * overlaps one of them. Not thread-safe: one instance lives for a single classification.
 */
public final class SpanSet {
    private final List<Span> spans = new ArrayList<>();

    public static SpanSet empty() {
        return new SpanSet();
    }

    public static SpanSet of(List<Span> spans) {
        SpanSet set = new SpanSet();
        spans.forEach(set::add);
        return set;
    }

    public void add(Span span) {
        spans.add(span);
    }

    public boolean overlaps(Span span) {
        for (Span s : spans) {
            if (s.overlaps(span)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    public List<Span> spans() {
        return List.copyOf(spans);
    }
}
