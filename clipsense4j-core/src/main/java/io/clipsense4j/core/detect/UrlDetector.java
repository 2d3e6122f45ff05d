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

/**
 * Finds http, https and ftp URLs. Trailing sentence punctuation is not part of the URL;
 * the domain is lower-cased and mapped to a coarse category.
 */
public final class UrlDetector implements Detector<Detection.Url> {
    static final double CONFIDENCE = 0.95;

    private static final Pattern P =
            Pattern.compile("(?<![A-Za-z0-9+.\\-])(?:https?|ftp)://[^\\s<>\"'`]+", Pattern.CASE_INSENSITIVE);
    private static final String TRAILING = ".,;:!?)]}'\"";

    @Override
    public ContentType family() {
        return ContentType.URL;
    }

    @Override
    public List<Detection.Url> detect(String s) {
        if (s == null || !s.contains("://")) return List.of();
        Matcher m = P.matcher(s);
        Set<String> seen = new HashSet<>();
        List<Detection.Url> out = new ArrayList<>();
        while (m.find()) {
            String url = trimTrailing(m.group());
            String domain = domainOf(url);
            if (domain.isEmpty()) continue;
            if (!seen.add(url.toLowerCase(Locale.ROOT))) continue;
            Span span = new Span(m.start(), m.start() + url.length());
            out.add(new Detection.Url(span, url, domain, categorize(domain), CONFIDENCE));
        }
        return List.copyOf(out);
    }

    private static String trimTrailing(String url) {
        int end = url.length();
        while (end > 0 && TRAILING.indexOf(url.charAt(end - 1)) >= 0) {
            // keep a closing paren that balances one inside the URL (wiki links)
            if (url.charAt(end - 1) == ')' && count(url, '(', end) > count(url, ')', end - 1)) break;
            end--;
        }
        return url.substring(0, end);
    }

    private static int count(String s, char c, int end) {
        int n = 0;
        for (int i = 0; i < end; i++) if (s.charAt(i) == c) n++;
        return n;
    }

    /** Host part of the authority, without user info or port, lower-cased. */
    static String domainOf(String url) {
        int start = url.indexOf("://") + 3;
        int end = start;
        while (end < url.length() && "/?#".indexOf(url.charAt(end)) < 0) end++;
        String authority = url.substring(start, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1);
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return close > 0 ? authority.substring(1, close).toLowerCase(Locale.ROOT) : "";
        }
        int colon = authority.indexOf(':');
        if (colon >= 0) authority = authority.substring(0, colon);
        return authority.toLowerCase(Locale.ROOT);
    }

    static String categorize(String domain) {
        if (is(domain, "github.com")) return "github";
        if (is(domain, "stackoverflow.com")) return "stackoverflow";
        if (is(domain, "docs.google.com")) return "google-docs";
        if (is(domain, "google.com")) return "google";
        if (is(domain, "developer.apple.com")) return "apple-developer";
        if (is(domain, "apple.com")) return "apple";
        if (is(domain, "youtube.com") || is(domain, "youtu.be")) return "youtube";
        if (is(domain, "twitter.com") || is(domain, "x.com")) return "x";
        if (domain.endsWith(".edu")) return "education";
        if (domain.endsWith(".gov")) return "government";
        return "other";
    }

    private static boolean is(String domain, String base) {
        return domain.equals(base) || domain.endsWith("." + base);
    }
}
