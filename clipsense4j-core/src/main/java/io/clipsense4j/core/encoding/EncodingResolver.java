/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.encoding;

import io.clipsense4j.core.api.model.DecodeResult;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Peels up to {@code maxRounds} layers of percent or base64 encoding off a payload.
 *
 * <p>Each round tries both decodings and keeps the acceptable one with the higher
 * printable ratio (percent-decoding wins ties). A round with no acceptable candidate
 * ends the chain. Stateless and thread-safe.</p>
 */
public final class EncodingResolver {
    public static final int DEFAULT_MAX_ROUNDS = 3;

    private static final double MIN_BASE64_PRINTABLE_RATIO = 0.9;
    private static final int MIN_BASE64_LENGTH = 8;
    private static final int UNMARKED_BASE64_LENGTH = 24;

    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%[0-9A-Fa-f]{2}");
    private static final Pattern BASE64_BODY = Pattern.compile("[A-Za-z0-9+/]+={0,2}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxRounds;

    public EncodingResolver() {
        this(DEFAULT_MAX_ROUNDS);
    }

    public EncodingResolver(int maxRounds) {
        if (maxRounds < 0) throw new IllegalArgumentException("maxRounds must be >= 0");
        this.maxRounds = maxRounds;
    }

    public DecodeResult resolve(String text) {
        if (text == null || text.isBlank()) return DecodeResult.none(text == null ? "" : text);
        String original = text.strip();
        String current = original;
        List<String> steps = new ArrayList<>();
        double ratio = 0.0;

        for (int round = 0; round < maxRounds; round++) {
            Optional<Candidate> percent = percentCandidate(current);
            Optional<Candidate> base64 = base64Candidate(current);
            Candidate chosen;
            if (percent.isPresent() && base64.isPresent()) {
                chosen = base64.get().printableRatio() > percent.get().printableRatio() ? base64.get() : percent.get();
            } else if (percent.isPresent()) {
                chosen = percent.get();
            } else if (base64.isPresent()) {
                chosen = base64.get();
            } else {
                break;
            }
            steps.add(chosen.step());
            current = chosen.text().strip();
            ratio = chosen.printableRatio();
        }

        if (steps.isEmpty()) return DecodeResult.none(original);
        double confidence = Math.min(0.95, 0.75 + 0.05 * steps.size() + 0.1 * ratio);
        return new DecodeResult(original, current, steps, confidence);
    }

    private static Optional<Candidate> percentCandidate(String s) {
        if (!PERCENT_ESCAPE.matcher(s).find()) return Optional.empty();
        byte[] raw = s.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[raw.length];
        int n = 0;
        for (int i = 0; i < raw.length; i++) {
            byte b = raw[i];
            if (b == '%' && i + 2 < raw.length && isHex(raw[i + 1]) && isHex(raw[i + 2])) {
                out[n++] = (byte) ((Character.digit(raw[i + 1], 16) << 4) | Character.digit(raw[i + 2], 16));
                i += 2;
            } else {
                out[n++] = b;
            }
        }
        return strictUtf8(out, n)
                .filter(d -> acceptable(d, s))
                .map(d -> new Candidate(DecodeResult.URL, d, printableRatio(d)));
    }

    private static Optional<Candidate> base64Candidate(String s) {
        String compact = WHITESPACE.matcher(s).replaceAll("");
        if (compact.length() < MIN_BASE64_LENGTH || compact.length() % 4 != 0) return Optional.empty();
        if (!BASE64_BODY.matcher(compact).matches() || !hasBase64Marker(compact)) return Optional.empty();
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(compact);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return strictUtf8(bytes, bytes.length)
                .filter(d -> acceptable(d, s))
                .map(d -> new Candidate(DecodeResult.BASE64, d, printableRatio(d)))
                .filter(c -> c.printableRatio() >= MIN_BASE64_PRINTABLE_RATIO);
    }

    /** Short letter-only runs are ordinary words ({@code Question}); they need padding, a digit, + or /. */
    private static boolean hasBase64Marker(String compact) {
        if (compact.length() >= UNMARKED_BASE64_LENGTH || compact.endsWith("=")) return true;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            if (Character.isDigit(c) || c == '+' || c == '/') return true;
        }
        return false;
    }

    private static boolean acceptable(String decoded, String input) {
        return !decoded.isBlank() && !decoded.equals(input);
    }

    private static Optional<String> strictUtf8(byte[] bytes, int len) {
        try {
            return Optional.of(StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, len))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    /** Share of code points that are not control characters (tab and newlines count as printable). */
    static double printableRatio(String s) {
        if (s.isEmpty()) return 0.0;
        long total = s.codePoints().count();
        long printable = s.codePoints()
                .filter(cp -> cp == '\n' || cp == '\r' || cp == '\t' || !Character.isISOControl(cp))
                .filter(cp -> Character.getType(cp) != Character.UNASSIGNED && cp != 0xFFFD)
                .count();
        return (double) printable / total;
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    private record Candidate(String step, String text, double printableRatio) {}
}
