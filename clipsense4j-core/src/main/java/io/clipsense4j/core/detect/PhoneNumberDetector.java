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
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds international ({@code +CC}) and grouped national phone numbers with 7-15 digits.
 * Numbers glued to letters, digits or dotted numeric literals (IPs, versions) are skipped.
 */
public final class PhoneNumberDetector implements Detector<Detection.PhoneNumber> {
    static final double CONFIDENCE = 0.9;

    private static final Pattern P = Pattern.compile(
            "(?<![\\w+.\\-/:])("
                    + "\\+\\d{1,3}[ .\\-]?\\(?\\d{1,4}\\)?(?:[ .\\-]?\\d{2,4}){2,4}"
                    + "|\\(\\d{2,4}\\)[ .\\-]?\\d{3,4}[ .\\-]?\\d{3,4}"
                    + "|\\d{3}[.\\-]\\d{3}[.\\-]\\d{4}"
                    + "|\\d{3} \\d{3} \\d{4}"
                    + ")(?![\\w/:])(?![.\\-]\\d)");

    @Override
    public ContentType family() {
        return ContentType.PHONE_NUMBER;
    }

    @Override
    public List<Detection.PhoneNumber> detect(String s) {
        if (s == null || s.length() < 7) return List.of();
        Matcher m = P.matcher(s);
        Set<String> seen = new HashSet<>();
        List<Detection.PhoneNumber> out = new ArrayList<>();
        while (m.find()) {
            String number = m.group(1);
            String digits = digitsOf(number);
            if (digits.length() < 7 || digits.length() > 15) continue;
            if (seen.add(digits)) out.add(new Detection.PhoneNumber(new Span(m.start(1), m.end(1)), number, CONFIDENCE));
        }
        return List.copyOf(out);
    }

    static String digitsOf(String number) {
        StringBuilder sb = new StringBuilder(number.length());
        for (int i = 0; i < number.length(); i++) {
            char c = number.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }
}
