/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Finding;
import io.clipsense4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class MicrometerReporter implements Reporter {
    static final String CLASSIFICATIONS = "clipsense4j_classifications_total";
    static final String DETECTOR_FAILURES = "clipsense4j_detector_failures_total";

    private final MeterRegistry registry;
    private final Deque<Finding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return;
        for (Finding f : findings) {
            registry.counter(
                            CLASSIFICATIONS,
                            "type", f.type().wireName(),
                            "role", f.role().name().toLowerCase(Locale.ROOT))
                    .increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(f);
        }
    }

    @Override
    public void detectorFailed(ContentType family, Throwable error) {
        registry.counter(DETECTOR_FAILURES, "family", family.wireName()).increment();
    }

    /** Returns an unmodifiable snapshot of the recent findings ring buffer. */
    public synchronized List<Finding> recentFindings() {
        return List.copyOf(ring);
    }
}
