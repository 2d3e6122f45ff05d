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

/**
 * Detects API keys and tokens from well-known providers (OpenAI, GitHub, Stripe, AWS...).
 *
 * <p>Every match must be bounded: the characters right before and after the key are
 * start/end of text, whitespace or a delimiter such as a quote, {@code =} or a bracket.
 * A key embedded in a longer unbroken run (a JWT segment, base64 blob) is ignored.</p>
 *
 * <p>Keys that look like placeholders or samples are reported with half confidence and
 * {@code likelyLive=false}.</p>
 */
public final class ApiKeyDetector implements Detector<Detection.ApiKey> {
    private static final int MIN_LENGTH = 16;
    private static final String BOUNDARY = " \t\n\r\"'=:,;()[]{}<>|`";
    private static final String AWS_SECRET = "AWS Secret Key";

    private static final List<String> TEST_INDICATORS = List.of(
            "test", "example", "sample", "demo", "fake", "dummy",
            "placeholder", "xxx", "your_", "your-", "insert", "replace",
            "todo", "fixme", "changeme", "secret_here", "key_here",
            "0000000", "1111111", "aaaaaaa", "abcdef");

    /** Provider pattern; when the regex has a capture group, group 1 is the key. */
    private record KeyPattern(String provider, Pattern pattern, double confidence) {
        KeyPattern(String provider, String regex) {
            this(provider, Pattern.compile(regex), 0.95);
        }

        KeyPattern(String provider, String regex, double confidence) {
            this(provider, Pattern.compile(regex), confidence);
        }
    }

    private static final List<KeyPattern> PATTERNS = List.of(
            new KeyPattern("OpenAI", "sk-[a-zA-Z0-9]{20}T3BlbkFJ[a-zA-Z0-9]{20}"),
            new KeyPattern("OpenAI", "sk-proj-[a-zA-Z0-9\\-_]{80,180}"),
            new KeyPattern("OpenAI", "sk-[a-zA-Z0-9]{48}", 0.85),
            new KeyPattern("Anthropic", "sk-ant-api03-[a-zA-Z0-9\\-_]{93}"),
            new KeyPattern("Anthropic", "sk-ant-[a-zA-Z0-9\\-_]{40,100}", 0.90),
            new KeyPattern("Google Cloud", "AIza[0-9A-Za-z\\-_]{35}"),
            new KeyPattern("AWS Access Key", "AKIA[0-9A-Z]{16}"),
            new KeyPattern(AWS_SECRET, "(?<![A-Za-z0-9/+])[A-Za-z0-9/+=]{40}(?![A-Za-z0-9/+=])", 0.70),
            new KeyPattern("GitHub PAT", "ghp_[a-zA-Z0-9]{36}"),
            new KeyPattern("GitHub PAT (fine-grained)", "github_pat_[a-zA-Z0-9]{22}_[a-zA-Z0-9]{59}"),
            new KeyPattern("GitHub OAuth", "gho_[a-zA-Z0-9]{36}"),
            new KeyPattern("GitHub App", "ghu_[a-zA-Z0-9]{36}"),
            new KeyPattern("GitHub Refresh", "ghr_[a-zA-Z0-9]{36}"),
            new KeyPattern("Stripe Secret", "sk_live_[a-zA-Z0-9]{24,}"),
            new KeyPattern("Stripe Test", "sk_test_[a-zA-Z0-9]{24,}"),
            new KeyPattern("Stripe Publishable", "pk_live_[a-zA-Z0-9]{24,}"),
            new KeyPattern("Stripe Restricted", "rk_live_[a-zA-Z0-9]{24,}"),
            new KeyPattern("Slack Bot", "xoxb-[0-9]{10,13}-[0-9]{10,13}-[a-zA-Z0-9]{24}"),
            new KeyPattern("Slack User", "xoxp-[0-9]{10,13}-[0-9]{10,13}-[a-zA-Z0-9]{24}"),
            new KeyPattern("Slack App", "xapp-[0-9]-[A-Z0-9]+-[0-9]+-[a-zA-Z0-9]+"),
            new KeyPattern("Slack Webhook", "https://hooks\\.slack\\.com/services/T[A-Z0-9]+/B[A-Z0-9]+/[a-zA-Z0-9]+"),
            new KeyPattern("Twilio API Key", "SK[a-f0-9]{32}"),
            new KeyPattern("Twilio Account SID", "AC[a-f0-9]{32}"),
            new KeyPattern("SendGrid", "SG\\.[a-zA-Z0-9\\-_]{22}\\.[a-zA-Z0-9\\-_]{43}"),
            new KeyPattern("Mailgun", "key-[a-f0-9]{32}"),
            new KeyPattern("npm Token", "npm_[a-zA-Z0-9]{36}"),
            new KeyPattern("PyPI Token", "pypi-[a-zA-Z0-9\\-_]{100,}"),
            new KeyPattern("DigitalOcean", "dop_v1_[a-f0-9]{64}"),
            new KeyPattern("DigitalOcean", "doo_v1_[a-f0-9]{64}"),
            new KeyPattern("Discord Bot", "[MN][A-Za-z\\d]{23,}\\.[\\w-]{6}\\.[\\w-]{27}"),
            new KeyPattern("Discord Webhook", "https://discord(?:app)?\\.com/api/webhooks/[0-9]+/[A-Za-z0-9_-]+"),
            new KeyPattern("Firebase", "AAAA[A-Za-z0-9_-]{7}:[A-Za-z0-9_-]{140}"),
            new KeyPattern("Linear API Key", "lin_api_[a-zA-Z0-9]{40}"),
            new KeyPattern("Supabase", "sbp_[a-f0-9]{40}"),
            new KeyPattern("Replicate", "r8_[a-zA-Z0-9]{37}"),
            new KeyPattern("HuggingFace", "hf_[a-zA-Z0-9]{34}"),
            new KeyPattern("Mapbox", "pk\\.[a-zA-Z0-9]{60,}"),
            new KeyPattern("Mapbox Secret", "sk\\.[a-zA-Z0-9]{60,}"),
            new KeyPattern("PlanetScale", "pscale_tkn_[a-zA-Z0-9_]+"),
            new KeyPattern("Generic API Key", "(?i)api[_-]?key['\":\\s=]+['\"]?([a-zA-Z0-9\\-_]{20,})['\"]?", 0.65),
            new KeyPattern("Generic Secret", "(?i)secret[_-]?key['\":\\s=]+['\"]?([a-zA-Z0-9\\-_]{20,})['\"]?", 0.65),
            new KeyPattern("Generic Token", "(?i)access[_-]?token['\":\\s=]+['\"]?([a-zA-Z0-9\\-_]{20,})['\"]?", 0.65),
            new KeyPattern("Bearer Token", "Bearer\\s+([a-zA-Z0-9\\-_.]{20,})", 0.80));

    @Override
    public ContentType family() {
        return ContentType.API_KEY;
    }

    @Override
    public List<Detection.ApiKey> detect(String s) {
        if (s == null || s.strip().length() < MIN_LENGTH) return List.of();

        List<Detection.ApiKey> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (KeyPattern kp : PATTERNS) {
            Matcher m = kp.pattern().matcher(s);
            while (m.find()) {
                int g = m.groupCount() >= 1 ? 1 : 0;
                Span span = new Span(m.start(g), m.end(g));
                String key = m.group(g);
                if (!hasBoundary(s, span)) continue;
                if (kp.provider().equals(AWS_SECRET) && !looksLikeAwsSecret(key)) continue;
                if (found.stream().anyMatch(d -> d.span().overlaps(span))) continue;
                if (!seen.add(key)) continue;

                boolean live = !isTestOrExampleKey(key);
                double confidence = live ? kp.confidence() : kp.confidence() * 0.5;
                found.add(new Detection.ApiKey(span, key, kp.provider(), live, confidence));
            }
        }
        if (found.isEmpty()) return List.of();

        found.sort(Comparator.comparingDouble(Detection.ApiKey::confidence).reversed());
        Detection.ApiKey top = found.get(0);
        if (top.confidence() >= 0.85) {
            found.removeIf(d -> d.confidence() < 0.60 && !d.provider().equals(top.provider()));
        }
        return List.copyOf(found);
    }

    /** True when the best key found covers more than 80% of the text with confidence >= 0.7. */
    public boolean isEntirelyApiKey(String text) {
        if (text == null) return false;
        String trimmed = text.strip();
        List<Detection.ApiKey> found = detect(trimmed);
        if (found.isEmpty()) return false;
        Detection.ApiKey first = found.get(0);
        return (double) first.key().length() / trimmed.length() > 0.8 && first.confidence() >= 0.70;
    }

    static boolean hasBoundary(String text, Span span) {
        if (span.start() > 0 && BOUNDARY.indexOf(text.charAt(span.start() - 1)) < 0) return false;
        return span.end() >= text.length() || BOUNDARY.indexOf(text.charAt(span.end())) >= 0;
    }

    /** A 40-char AWS secret mixes upper, lower and digit characters; plain hex digests do not. */
    private static boolean looksLikeAwsSecret(String key) {
        if (key.startsWith("/")) return false;
        boolean upper = false, lower = false, digit = false;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c)) upper = true;
            else if (Character.isLowerCase(c)) lower = true;
            else if (Character.isDigit(c)) digit = true;
        }
        return upper && lower && digit;
    }

    static boolean isTestOrExampleKey(String key) {
        String lowered = key.toLowerCase(Locale.ROOT);
        for (String indicator : TEST_INDICATORS) {
            if (lowered.contains(indicator)) return true;
        }
        long unique = key.chars().filter(Character::isLetterOrDigit).distinct().count();
        return unique < 4 && key.length() > 10;
    }
}
