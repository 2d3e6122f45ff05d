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
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds IPv4 and IPv6 literals and flags private, loopback, link-local and multicast ranges. */
public final class IpAddressDetector implements Detector<Detection.IpAddress> {
    static final double V4_CONFIDENCE = 0.9;
    static final double V6_CONFIDENCE = 0.85;

    private static final String OCTET = "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";
    private static final String IPV4 = OCTET + "(?:\\." + OCTET + "){3}";
    private static final String H = "[0-9a-f]{1,4}";

    private static final Pattern V4 = Pattern.compile("(?<![0-9])(?<!\\d\\.)(" + IPV4 + ")(?![0-9])(?!\\.\\d)");

    private static final Pattern V6 = Pattern.compile(
            "(?<![0-9a-z:])("
                    + "(?:" + H + ":){7}" + H
                    + "|(?:" + H + ":){1,7}:"
                    + "|(?:" + H + ":){1,6}:" + H
                    + "|(?:" + H + ":){1,5}(?::" + H + "){1,2}"
                    + "|(?:" + H + ":){1,4}(?::" + H + "){1,3}"
                    + "|(?:" + H + ":){1,3}(?::" + H + "){1,4}"
                    + "|(?:" + H + ":){1,2}(?::" + H + "){1,5}"
                    + "|" + H + ":(?::" + H + "){1,6}"
                    + "|:(?:(?::" + H + "){1,7}|:)"
                    + "|fe80:(?::[0-9a-f]{0,4}){0,4}%[0-9a-z]+"
                    + "|::(?:ffff(?::0{1,4})?:)?" + IPV4
                    + "|(?:" + H + ":){1,4}:" + IPV4
                    + ")(?![0-9a-z:%])(?!\\.\\d)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public ContentType family() {
        return ContentType.IP_ADDRESS;
    }

    @Override
    public List<Detection.IpAddress> detect(String s) {
        if (s == null || s.length() < 2) return List.of();
        List<Detection.IpAddress> v6 = new ArrayList<>();
        if (s.indexOf(':') >= 0) {
            Matcher m = V6.matcher(s);
            while (m.find()) {
                String address = m.group(1).toLowerCase(Locale.ROOT);
                if (!hasHexDigit(address)) continue;
                v6.add(ipv6(new Span(m.start(1), m.end(1)), address));
            }
        }
        List<Detection.IpAddress> all = new ArrayList<>(v6);
        Matcher m = V4.matcher(s);
        while (m.find()) {
            Span span = new Span(m.start(1), m.end(1));
            if (v6.stream().anyMatch(d -> d.span().overlaps(span))) continue;
            all.add(ipv4(span, m.group(1)));
        }
        all.sort(Comparator.comparingInt(d -> d.span().start()));

        Set<String> seen = new HashSet<>();
        List<Detection.IpAddress> out = new ArrayList<>();
        for (Detection.IpAddress d : all) {
            if (seen.add(d.address())) out.add(d);
        }
        return List.copyOf(out);
    }

    private static Detection.IpAddress ipv4(Span span, String address) {
        String[] parts = address.split("\\.");
        int a = Integer.parseInt(parts[0]);
        int b = Integer.parseInt(parts[1]);
        boolean isPrivate = a == 10 || (a == 172 && b >= 16 && b <= 31) || (a == 192 && b == 168);
        boolean loopback = a == 127;
        boolean linkLocal = a == 169 && b == 254;
        boolean multicast = a >= 224 && a <= 239;
        return new Detection.IpAddress(
                span, address, Detection.IpAddress.V4, isPrivate, loopback, linkLocal, multicast, V4_CONFIDENCE);
    }

    private static Detection.IpAddress ipv6(Span span, String address) {
        boolean loopback = address.equals("::1");
        boolean linkLocal = address.startsWith("fe80:");
        boolean multicast = address.startsWith("ff");
        boolean isPrivate = address.startsWith("fc") || address.startsWith("fd");
        return new Detection.IpAddress(
                span, address, Detection.IpAddress.V6, isPrivate, loopback, linkLocal, multicast, V6_CONFIDENCE);
    }

    private static boolean hasHexDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) >= 0) return true;
        }
        return false;
    }
}
