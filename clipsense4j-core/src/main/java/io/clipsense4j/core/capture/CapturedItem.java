/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.capture;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A payload as it comes off the clipboard. For images and screenshots {@code content} is
 * an opaque reference (file name or hash) chosen by the host.
 *
 * @param sourceApp bundle or process id of the copying application, may be null
 */
public record CapturedItem(UUID id, CaptureKind kind, String content, String sourceApp, Instant timestamp) {
    public CapturedItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        content = content == null ? "" : content;
    }

    public static CapturedItem text(String content, String sourceApp, Instant timestamp) {
        return new CapturedItem(UUID.randomUUID(), CaptureKind.TEXT, content, sourceApp, timestamp);
    }

    /** Text capture from raw bytes; malformed UTF-8 sequences become U+FFFD. */
    public static CapturedItem fromBytes(byte[] bytes, String sourceApp, Instant timestamp) {
        String content = bytes == null ? "" : StandardCharsets.UTF_8.decode(ByteBuffer.wrap(bytes)).toString();
        return text(content, sourceApp, timestamp);
    }
}
