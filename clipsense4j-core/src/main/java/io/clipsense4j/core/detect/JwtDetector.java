/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds JSON Web Tokens: three base64url segments whose header and payload decode to JSON
 * objects. Registered claims are surfaced; expiry is judged against the injected clock.
 */
public final class JwtDetector implements Detector<Detection.Jwt> {
    static final double CONFIDENCE = 0.95;

    private static final String SEG = "[A-Za-z0-9_\\-]";
    private static final Pattern P = Pattern.compile("(?<!" + SEG + ")(?<!" + SEG + "\\.)"
            + "(" + SEG + "+\\." + SEG + "+\\." + SEG + "+)"
            + "(?!" + SEG + ")(?!\\." + SEG + ")");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public JwtDetector() {
        this(Clock.systemUTC());
    }

    public JwtDetector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ContentType family() {
        return ContentType.JWT;
    }

    @Override
    public List<Detection.Jwt> detect(String s) {
        if (s == null || s.indexOf('.') < 0) return List.of();
        Matcher m = P.matcher(s);
        Set<String> seen = new HashSet<>();
        List<Detection.Jwt> out = new ArrayList<>();
        while (m.find()) {
            String token = m.group(1);
            if (!seen.add(token)) continue;
            decode(token, new Span(m.start(1), m.end(1))).ifPresent(out::add);
        }
        return List.copyOf(out);
    }

    private Optional<Detection.Jwt> decode(String token, Span span) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) return Optional.empty();
        Optional<JsonNode> header = jsonObject(parts[0]);
        Optional<JsonNode> payload = jsonObject(parts[1]);
        if (header.isEmpty() || payload.isEmpty()) return Optional.empty();

        JsonNode claims = payload.get();
        Long iat = epochSeconds(claims.get("iat"));
        Long exp = epochSeconds(claims.get("exp"));
        Boolean expired = exp == null ? null : exp < clock.instant().getEpochSecond();
        return Optional.of(new Detection.Jwt(
                span,
                token,
                header.get().toString(),
                claims.toString(),
                text(claims.get("sub")),
                text(claims.get("iss")),
                iat,
                exp,
                expired,
                CONFIDENCE));
    }

    private static Optional<JsonNode> jsonObject(String segment) {
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(segment);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(new String(bytes, StandardCharsets.UTF_8));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static Long epochSeconds(JsonNode node) {
        if (node == null) return null;
        if (node.isNumber()) return node.longValue();
        if (node.isTextual()) {
            try {
                double d = Double.parseDouble(node.asText().trim());
                return Double.isFinite(d) ? (long) d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
