/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.clipsense4j.core.api.model.Detection;
import java.util.List;
import org.junit.jupiter.api.Test;

class UuidDetectorTest {

    private final UuidDetector detector = new UuidDetector();

    @Test
    void detect_shouldLowerCaseAndDecodeVersion() {
        List<Detection.Uuid> found = detector.detect("id=550E8400-E29B-41D4-A716-446655440000");

        assertThat(found).hasSize(1);
        Detection.Uuid uuid = found.get(0);
        assertThat(uuid.uuid()).isEqualTo("550e8400-e29b-41d4-a716-446655440000");
        assertThat(uuid.version()).isEqualTo(4);
        assertThat(uuid.variant()).isEqualTo("rfc4122");
    }

    @Test
    void detect_shouldRequireCanonicalLayout() {
        assertThat(detector.detect("550e8400e29b41d4a716446655440000")).isEmpty();
        assertThat(detector.detect("550e8400-e29b-41d4-a716-4466554400001")).isEmpty();
    }

    @Test
    void variant_shouldFollowTheVariantNibble() {
        assertThat(UuidDetector.variant("00000000-0000-0000-0000-000000000000")).isEqualTo("ncs");
        assertThat(UuidDetector.variant("00000000-0000-0000-c000-000000000000")).isEqualTo("microsoft");
        assertThat(UuidDetector.variant("00000000-0000-0000-f000-000000000000")).isEqualTo("future");
    }
}
