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

/** Finds e-mail addresses, keeping the first-seen casing and de-duplicating case-insensitively. */
public final class EmailDetector implements Detector<Detection.Email> {
    static final double CONFIDENCE = 0.95;

    private static final String LABEL = "[A-Z0-9](?:[A-Z0-9\\-]{0,61}[A-Z0-9])?";
    private static final Pattern P = Pattern.compile(
            "(?<![A-Z0-9._%+\\-@])"
                    + "([A-Z0-9](?:[A-Z0-9._%+\\-]{0,62}[A-Z0-9])?)"
                    + "@(" + LABEL + "(?:\\." + LABEL + ")+)"
                    + "(?![A-Z0-9_%+\\-@])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TLD = Pattern.compile("[A-Za-z]{2,}");

    @Override
    public ContentType family() {
        return ContentType.EMAIL;
    }

    @Override
    public List<Detection.Email> detect(String s) {
        if (s == null || s.indexOf('@') < 0) return List.of();
        Matcher m = P.matcher(s);
        Set<String> seen = new HashSet<>();
        List<Detection.Email> out = new ArrayList<>();
        while (m.find()) {
            String domain = m.group(2);
            String tld = domain.substring(domain.lastIndexOf('.') + 1);
            if (!TLD.matcher(tld).matches()) continue;
            String email = m.group();
            if (seen.add(email.toLowerCase(Locale.ROOT))) {
                out.add(new Detection.Email(new Span(m.start(), m.end()), email, CONFIDENCE));
            }
        }
        return List.copyOf(out);
    }
}
