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
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds digests by shape: hex strings of the standard MD5/SHA lengths, and base64 encoded
 * SHA-2 family digests.
 */
public final class HashDetector implements Detector<Detection.Hash> {
    static final double HEX_CONFIDENCE = 0.85;
    static final double BASE64_CONFIDENCE = 0.75;

    private static final Pattern HEX = Pattern.compile(
            "(?<![0-9a-f])([0-9a-f]{128}|[0-9a-f]{96}|[0-9a-f]{64}|[0-9a-f]{56}|[0-9a-f]{40}|[0-9a-f]{32})(?![0-9a-f])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BASE64 = Pattern.compile("(?<![A-Za-z0-9+/=])("
            + "[A-Za-z0-9+/]{171}={0,1}"
            + "|[A-Za-z0-9+/]{128}"
            + "|[A-Za-z0-9+/]{86}={0,2}"
            + "|[A-Za-z0-9+/]{43}={0,1}"
            + ")(?![A-Za-z0-9+/=])");

    private record Kind(String name, int bits) {}

    private static final Map<Integer, Kind> HEX_KINDS = Map.of(
            32, new Kind("md5", 128),
            40, new Kind("sha1", 160),
            56, new Kind("sha224", 224),
            64, new Kind("sha256", 256),
            96, new Kind("sha384", 384),
            128, new Kind("sha512", 512));

    private static final Map<Integer, Kind> BASE64_KINDS = Map.of(
            43, new Kind("sha256-base64", 256),
            44, new Kind("sha256-base64", 256),
            86, new Kind("sha512-base64", 512),
            88, new Kind("sha512-base64", 512),
            128, new Kind("sha768-base64", 768),
            171, new Kind("sha1024-base64", 1024),
            172, new Kind("sha1024-base64", 1024));

    @Override
    public ContentType family() {
        return ContentType.HASH;
    }

    @Override
    public List<Detection.Hash> detect(String s) {
        if (s == null || s.length() < 32) return List.of();
        List<Detection.Hash> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        Matcher hex = HEX.matcher(s);
        while (hex.find()) {
            String hash = hex.group(1).toLowerCase(Locale.ROOT);
            Kind kind = HEX_KINDS.get(hash.length());
            if (kind == null || !seen.add(hash)) continue;
            out.add(new Detection.Hash(new Span(hex.start(1), hex.end(1)), hash, kind.name(), kind.bits(), HEX_CONFIDENCE));
        }

        Matcher b64 = BASE64.matcher(s);
        while (b64.find()) {
            String hash = b64.group(1);
            Kind kind = BASE64_KINDS.get(hash.length());
            if (kind == null || !mixedAlphabet(hash) || !seen.add(hash.toLowerCase(Locale.ROOT))) continue;
            Span span = new Span(b64.start(1), b64.end(1));
            if (out.stream().anyMatch(d -> d.span().overlaps(span))) continue;
            out.add(new Detection.Hash(span, hash, kind.name(), kind.bits(), BASE64_CONFIDENCE));
        }
        out.sort((a, b) -> Integer.compare(a.span().start(), b.span().start()));
        return List.copyOf(out);
    }

    /** Random digest bytes encode to upper, lower and digit characters alike. */
    private static boolean mixedAlphabet(String s) {
        boolean upper = false, lower = false, digit = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') upper = true;
            else if (c >= 'a' && c <= 'z') lower = true;
            else if (c >= '0' && c <= '9') digit = true;
        }
        return upper && lower && digit;
    }
}
