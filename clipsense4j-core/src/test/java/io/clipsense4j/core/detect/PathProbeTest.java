/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathProbeTest {

    @TempDir
    Path dir;

    @Test
    void timeoutGuarded_shouldStatRealFiles() throws IOException {
        Path file = Files.createFile(dir.resolve("notes.txt"));
        PathProbe probe = PathProbe.timeoutGuarded(Duration.ofSeconds(2));

        assertThat(probe.exists(file.toString())).isTrue();
        assertThat(probe.exists(dir.resolve("absent.txt").toString())).isFalse();
    }

    @Test
    void timeoutGuarded_shouldTreatInvalidPathsAsMissing() {
        assertThat(PathProbe.timeoutGuarded(Duration.ofSeconds(2)).exists("bad\u0000path")).isFalse();
    }

    @Test
    void none_shouldNeverFindAnything() {
        assertThat(PathProbe.none().exists("/")).isFalse();
    }

    @Test
    void timeoutGuarded_shouldRequirePositiveTimeout() {
        assertThatThrownBy(() -> PathProbe.timeoutGuarded(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
