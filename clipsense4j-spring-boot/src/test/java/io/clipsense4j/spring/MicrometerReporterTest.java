/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Finding;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

class MicrometerReporterTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void report_shouldCountByTypeAndRole() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 50);

        reporter.report(List.of(
                new Finding(ContentType.EMAIL, Finding.Role.PRIMARY, 0.95),
                new Finding(ContentType.URL, Finding.Role.EXTRACTED, 0.95),
                new Finding(ContentType.URL, Finding.Role.EXTRACTED, 0.95)));

        assertThat(registry.get(MicrometerReporter.CLASSIFICATIONS)
                        .tags("type", "url", "role", "extracted")
                        .counter()
                        .count())
                .isEqualTo(2.0);
        assertThat(registry.get(MicrometerReporter.CLASSIFICATIONS)
                        .tags("type", "email", "role", "primary")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    void recentFindings_shouldKeepABoundedWindow() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 1);

        for (int i = 0; i < 15; i++) {
            reporter.report(List.of(new Finding(ContentType.TEXT, Finding.Role.PRIMARY, i / 100.0)));
        }

        List<Finding> recent = reporter.recentFindings();
        assertThat(recent).hasSize(10);
        assertThat(recent.get(0).confidence()).isEqualTo(0.05);
    }

    @Test
    void detectorFailed_shouldCountPerFamily() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 10);

        reporter.detectorFailed(ContentType.CODE, new IllegalStateException("boom"));

        assertThat(registry.get(MicrometerReporter.DETECTOR_FAILURES)
                        .tag("family", "code")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    void report_shouldIgnoreEmptyBatches() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 10);

        reporter.report(List.of());
        reporter.report(null);

        assertThat(reporter.recentFindings()).isEmpty();
        assertThat(registry.getMeters()).isEmpty();
    }
}
