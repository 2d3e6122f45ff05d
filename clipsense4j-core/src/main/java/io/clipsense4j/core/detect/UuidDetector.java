/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds canonical 8-4-4-4-12 UUIDs and decodes their version and variant. */
public final class UuidDetector implements Detector<Detection.Uuid> {
    static final double CONFIDENCE = 0.9;

    private static final Pattern P = Pattern.compile(
            "(?<![0-9a-f])([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})(?![0-9a-f])",
            Pattern.CASE_INSENSITIVE);

    @Override
    public ContentType family() {
        return ContentType.UUID;
    }

    @Override
    public List<Detection.Uuid> detect(String s) {
        if (s == null || s.length() < 36) return List.of();
        Matcher m = P.matcher(s);
        Set<String> seen = new HashSet<>();
        List<Detection.Uuid> out = new ArrayList<>();
        while (m.find()) {
            String uuid = m.group(1).toLowerCase(Locale.ROOT);
            if (!seen.add(uuid)) continue;
            out.add(new Detection.Uuid(new Span(m.start(1), m.end(1)), uuid, version(uuid), variant(uuid), CONFIDENCE));
        }
        return List.copyOf(out);
    }

    static Integer version(String uuid) {
        int v = Character.digit(uuid.charAt(14), 16);
        return v >= 0 && v <= 9 ? v : null;
    }

    static String variant(String uuid) {
        int v = Character.digit(uuid.charAt(19), 16);
        if (v <= 7) return "ncs";
        if (v <= 0xb) return "rfc4122";
        if (v <= 0xd) return "microsoft";
        return "future";
    }
}
