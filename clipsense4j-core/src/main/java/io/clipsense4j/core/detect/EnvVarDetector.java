/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code [export ]KEY=VALUE} lines. Blank lines and {@code #} comments are skipped.
 *
 * <p>{@link #analyze(String)} also decides whether the text is a block: at least two
 * assignments. Confidence is high only when every content line parsed; a block mixed with
 * other lines still has to outscore the other families before the classifier splits it.</p>
 */
public final class EnvVarDetector implements Detector<Detection.EnvVar> {
    static final double ALL_LINES_CONFIDENCE = 0.95;
    static final double PARTIAL_CONFIDENCE = 0.75;

    private static final Pattern EXPORT = Pattern.compile("^export\\s+");
    private static final Pattern KEY = Pattern.compile("[A-Z_][A-Z0-9_]*");

    /** Result of scanning every line of a payload. */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "vars is an immutable copy")
    public record Analysis(List<Detection.EnvVar> vars, boolean block, double confidence) {
        public Analysis {
            vars = List.copyOf(vars);
        }
    }

    private record Assignment(String key, String value, boolean exported) {}

    private record Parsed(Span span, Assignment assignment) {}

    @Override
    public ContentType family() {
        return ContentType.ENV_VAR;
    }

    @Override
    public List<Detection.EnvVar> detect(String s) {
        return analyze(s).map(Analysis::vars).orElse(List.of());
    }

    public Optional<Analysis> analyze(String s) {
        if (s == null || s.indexOf('=') < 0) return Optional.empty();

        List<Parsed> parsed = new ArrayList<>();
        int contentLines = 0;
        int pos = 0;
        while (pos <= s.length()) {
            int nl = s.indexOf('\n', pos);
            int end = nl < 0 ? s.length() : nl;
            String line = s.substring(pos, end);
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                contentLines++;
                int lead = pos + line.indexOf(trimmed.charAt(0));
                Span span = new Span(lead, lead + trimmed.length());
                parseLine(trimmed).ifPresent(a -> parsed.add(new Parsed(span, a)));
            }
            if (nl < 0) break;
            pos = nl + 1;
        }
        if (parsed.isEmpty()) return Optional.empty();

        boolean allParsed = parsed.size() == contentLines;
        double confidence = allParsed ? ALL_LINES_CONFIDENCE : PARTIAL_CONFIDENCE;
        List<Detection.EnvVar> vars = new ArrayList<>(parsed.size());
        for (Parsed p : parsed) {
            Assignment a = p.assignment();
            vars.add(new Detection.EnvVar(p.span(), a.key(), a.value(), a.exported(), confidence));
        }
        return Optional.of(new Analysis(vars, vars.size() >= 2, confidence));
    }

    private static Optional<Assignment> parseLine(String line) {
        Matcher export = EXPORT.matcher(line);
        boolean exported = export.find();
        String rest = exported ? line.substring(export.end()) : line;
        int eq = rest.indexOf('=');
        if (eq <= 0) return Optional.empty();
        String key = rest.substring(0, eq).strip();
        if (!KEY.matcher(key).matches()) return Optional.empty();
        String value = unquote(rest.substring(eq + 1).strip());
        return Optional.of(new Assignment(key, value, exported));
    }

    static String unquote(String v) {
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            return unescape(v.substring(1, v.length() - 1));
        }
        if (v.length() >= 2 && v.startsWith("'") && v.endsWith("'")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char n = s.charAt(i + 1);
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    default -> sb.append(c).append(n);
                }
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
