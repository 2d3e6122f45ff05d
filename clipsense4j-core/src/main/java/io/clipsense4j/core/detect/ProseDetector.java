/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognises natural-language paragraphs, as opposed to code or structured text. */
public final class ProseDetector implements Detector<Detection.Prose> {
    static final double THRESHOLD = 0.6;
    private static final int MIN_CHARS = 40;
    private static final int MIN_WORDS = 12;
    private static final int UNPUNCTUATED_MIN_WORDS = 30;
    private static final double WORDS_PER_MINUTE = 200.0;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:'[\\p{L}\\p{N}]+)?");
    private static final List<String> CODE_TOKENS =
            List.of("```", "{", "}", "#include", "import ", "func ", "struct ", "=>", "->", "::", ":=", "<html", "</");
    private static final Pattern SQL = Pattern.compile("\\bselect\\b.+\\bfrom\\b", Pattern.DOTALL);
    private static final Pattern DECLARATION = Pattern.compile("\\b(?:let|var|const)\\s+\\w+\\s*=");
    private static final Pattern CLASS_DECL = Pattern.compile("\\bclass\\s+[A-Z]\\w*\\s*[({:]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    @Override
    public ContentType family() {
        return ContentType.PROSE;
    }

    @Override
    public List<Detection.Prose> detect(String s) {
        if (s == null) return List.of();
        String trimmed = s.strip();
        if (trimmed.length() < MIN_CHARS) return List.of();
        if (containsCodeSignals(trimmed) || looksStructured(trimmed)) return List.of();

        int words = wordCount(trimmed);
        if (words < MIN_WORDS) return List.of();
        int sentences = (int) trimmed.chars().filter(c -> c == '.' || c == '!' || c == '?').count();
        if (sentences < 1 && words < UNPUNCTUATED_MIN_WORDS) return List.of();

        double confidence = 0.55;
        confidence += Math.min(0.25, words / 80.0);
        confidence += Math.min(0.15, sentences * 0.07);
        confidence -= Math.min(0.3, symbolRatio(trimmed) * 0.6);
        confidence = Math.min(0.95, Math.max(0.0, confidence));
        if (confidence < THRESHOLD) return List.of();

        int readingSeconds = (int) Math.ceil(words / WORDS_PER_MINUTE * 60.0);
        int start = s.indexOf(trimmed);
        return List.of(new Detection.Prose(new Span(start, start + trimmed.length()), words, readingSeconds, confidence));
    }

    private static boolean containsCodeSignals(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        for (String t : CODE_TOKENS) {
            if (lower.contains(t)) return true;
        }
        if (SQL.matcher(lower).find() || DECLARATION.matcher(s).find() || CLASS_DECL.matcher(s).find()) return true;
        return s.chars().filter(c -> c == ';').count() >= 2;
    }

    /** Mostly {@code KEY=value} or {@code key: value} lines. */
    private static boolean looksStructured(String s) {
        int structured = 0;
        int nonEmpty = 0;
        for (String raw : s.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            nonEmpty++;
            if (line.startsWith("#")) continue;
            if (line.indexOf('=') > 0) {
                structured++;
                continue;
            }
            int colon = line.indexOf(':');
            if (colon > 0 && !WHITESPACE.matcher(line.substring(0, colon)).find()) structured++;
        }
        return nonEmpty > 0 && structured >= 2 && (double) structured / nonEmpty >= 0.5;
    }

    static int wordCount(String s) {
        Matcher m = WORD.matcher(s);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static double symbolRatio(String s) {
        long total = s.codePoints().count();
        if (total == 0) return 0.0;
        long symbols = s.codePoints()
                .filter(cp -> !Character.isLetter(cp) && !Character.isWhitespace(cp))
                .count();
        return (double) symbols / total;
    }
}
