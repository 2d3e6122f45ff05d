/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.FileType;
import io.clipsense4j.core.api.model.Span;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds POSIX ({@code /}, {@code ~/}, {@code ./}, {@code ../}) and Windows ({@code C:\},
 * {@code C:/}) paths. Existence is asked of the {@link PathProbe}; an existing path scores
 * higher.
 */
public final class FilePathDetector implements Detector<Detection.FilePath> {
    static final double EXISTING_CONFIDENCE = 0.9;
    static final double MISSING_CONFIDENCE = 0.7;

    private static final Pattern WINDOWS =
            Pattern.compile("(?<![A-Z0-9_])([A-Z]:\\\\[^\\s\"'<>|]+|[A-Z]:/[^\\s\"'<>|]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNIX =
            Pattern.compile("(?<![A-Za-z]:)(?<![A-Za-z0-9_\\-/:.~\\\\])((?:~|\\.{1,2})?/[^\\s\"']+)");

    private static final String LEADING_TRIM = "([{<\"'";
    private static final String TRAILING_TRIM = ",.;:()[]{}<>\"'";

    private final PathProbe probe;
    private final String userHome;

    public FilePathDetector() {
        this(PathProbe.defaultProbe());
    }

    public FilePathDetector(PathProbe probe) {
        this(probe, System.getProperty("user.home", ""));
    }

    public FilePathDetector(PathProbe probe, String userHome) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.userHome = Objects.requireNonNullElse(userHome, "");
    }

    @Override
    public ContentType family() {
        return ContentType.FILE_PATH;
    }

    @Override
    public List<Detection.FilePath> detect(String s) {
        if (s == null || (s.indexOf('/') < 0 && s.indexOf('\\') < 0)) return List.of();
        List<Detection.FilePath> all = new ArrayList<>();
        collect(WINDOWS, s, true, all);
        collect(UNIX, s, false, all);
        all.sort(Comparator.comparingInt(d -> d.span().start()));

        Set<String> seen = new HashSet<>();
        List<Detection.FilePath> out = new ArrayList<>();
        for (Detection.FilePath d : all) {
            if (seen.add(d.path())) out.add(d);
        }
        return List.copyOf(out);
    }

    private void collect(Pattern pattern, String s, boolean windows, List<Detection.FilePath> into) {
        Matcher m = pattern.matcher(s);
        while (m.find()) {
            int start = m.start(1);
            int end = m.end(1);
            while (start < end && LEADING_TRIM.indexOf(s.charAt(start)) >= 0) start++;
            while (end > start && TRAILING_TRIM.indexOf(s.charAt(end - 1)) >= 0) end--;
            if (end - start < 2) continue;
            Span span = new Span(start, end);
            if (into.stream().anyMatch(d -> d.span().overlaps(span))) continue;
            into.add(describe(span, s.substring(start, end), windows));
        }
    }

    private Detection.FilePath describe(Span span, String raw, boolean windows) {
        String normalized = windows ? raw.replace('\\', '/') : raw;
        String path = expandTilde(normalized);
        boolean exists = probe.exists(path);
        String filename = filename(path);
        String extension = extension(filename);
        FileType type = FileTypes.classify(extension);
        return new Detection.FilePath(
                span,
                path,
                exists,
                filename,
                extension,
                type,
                FileTypes.mimeType(extension),
                exists ? EXISTING_CONFIDENCE : MISSING_CONFIDENCE);
    }

    private String expandTilde(String path) {
        if (userHome.isEmpty()) return path;
        if (path.equals("~")) return userHome;
        if (path.startsWith("~/")) return userHome + path.substring(1);
        return path;
    }

    static String filename(String path) {
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        int slash = p.lastIndexOf('/');
        return slash >= 0 ? p.substring(slash + 1) : p;
    }

    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) return null;
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
