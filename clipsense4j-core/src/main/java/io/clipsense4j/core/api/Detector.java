/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.SpanSet;
import java.util.List;

/**
 * Stateless detector for one content family. Returns detections in document order;
 * malformed input yields an empty list, never an exception.
 */
public interface Detector<D extends Detection> {

    ContentType family();

    List<D> detect(String text);

    /** Same as {@link #detect(String)} minus detections overlapping an ignored span. */
    default List<D> detect(String text, SpanSet ignored) {
        List<D> all = detect(text);
        if (ignored == null || ignored.isEmpty() || all.isEmpty()) return all;
        return all.stream().filter(d -> !ignored.overlaps(d.span())).toList();
    }
}
