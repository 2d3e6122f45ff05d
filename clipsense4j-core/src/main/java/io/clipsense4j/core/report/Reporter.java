/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.report;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Finding;
import java.util.List;

public interface Reporter {
    void report(List<Finding> findings);

    /** Called when a detector throws or fails to link; its output for that payload is discarded. */
    default void detectorFailed(ContentType family, Throwable error) {
        /* no-op */
    }
}
