/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.preset;

import io.clipsense4j.core.detect.PathProbe;
import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators detectors need from the host.
 *
 * @param clock     time source for token expiry
 * @param pathProbe filesystem existence check for file paths
 */
public record DetectorConfig(Clock clock, PathProbe pathProbe) {
    public DetectorConfig {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(pathProbe, "pathProbe");
    }

    public static DetectorConfig defaults() {
        return new DetectorConfig(Clock.systemUTC(), PathProbe.defaultProbe());
    }
}
