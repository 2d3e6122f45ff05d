/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Outcome of resolving layered encodings. {@code steps} lists the decodings applied,
 * outermost first; confidence is 0 when nothing was decoded.
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "steps is an immutable copy")
public record DecodeResult(String original, String decoded, List<String> steps, double confidence) {
    public static final String BASE64 = "base64";
    public static final String URL = "url";

    public DecodeResult {
        steps = List.copyOf(steps);
    }

    public static DecodeResult none(String text) {
        return new DecodeResult(text, text, List.of(), 0.0);
    }

    public boolean isDecoded() {
        return !steps.isEmpty();
    }

    /** The text classification should run on. */
    public String subject() {
        return isDecoded() ? decoded : original;
    }
}
