/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

/**
 * A single family-specific finding inside the classified text.
 *
 * <p>Detections are transient: the orchestrator turns them into metadata items and
 * extracted children, then drops them. Each record carries the span it was found at,
 * a confidence in [0,1] and the family payload.</p>
 */
public sealed interface Detection {

    Span span();

    double confidence();

    ContentType family();

    /** The value a derived child record would hold. */
    String value();

    record Email(Span span, String email, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.EMAIL;
        }

        @Override
        public String value() {
            return email;
        }
    }

    record Url(Span span, String url, String domain, String category, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.URL;
        }

        @Override
        public String value() {
            return url;
        }
    }

    record PhoneNumber(Span span, String number, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.PHONE_NUMBER;
        }

        @Override
        public String value() {
            return number;
        }
    }

    record IpAddress(
            Span span,
            String address,
            String version,
            boolean privateRange,
            boolean loopback,
            boolean linkLocal,
            boolean multicast,
            double confidence)
            implements Detection {
        public static final String V4 = "v4";
        public static final String V6 = "v6";

        @Override
        public ContentType family() {
            return ContentType.IP_ADDRESS;
        }

        @Override
        public String value() {
            return address;
        }
    }

    /** {@code version} is null when the version nibble is not a digit. */
    record Uuid(Span span, String uuid, Integer version, String variant, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.UUID;
        }

        @Override
        public String value() {
            return uuid;
        }
    }

    record Hash(Span span, String hash, String kind, int bits, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.HASH;
        }

        @Override
        public String value() {
            return hash;
        }
    }

    record ApiKey(Span span, String key, String provider, boolean likelyLive, double confidence)
            implements Detection {
        @Override
        public ContentType family() {
            return ContentType.API_KEY;
        }

        @Override
        public String value() {
            return key;
        }

        public ApiKey withConfidence(double c) {
            return new ApiKey(span, key, provider, likelyLive, c);
        }
    }

    /**
     * Decoded JSON Web Token. Claim times are epoch seconds; {@code expired} is null when
     * the token carries no {@code exp} claim.
     */
    record Jwt(
            Span span,
            String token,
            String headerJson,
            String payloadJson,
            String subject,
            String issuer,
            Long issuedAt,
            Long expiresAt,
            Boolean expired,
            double confidence)
            implements Detection {
        @Override
        public ContentType family() {
            return ContentType.JWT;
        }

        @Override
        public String value() {
            return token;
        }
    }

    record EnvVar(Span span, String key, String envValue, boolean exported, double confidence)
            implements Detection {
        @Override
        public ContentType family() {
            return ContentType.ENV_VAR;
        }

        /** Assignment form, prefixed with {@code export} when the source line was. */
        @Override
        public String value() {
            return (exported ? "export " : "") + key + "=" + envValue;
        }
    }

    record FilePath(
            Span span,
            String path,
            boolean exists,
            String filename,
            String extension,
            FileType fileType,
            String mimeType,
            double confidence)
            implements Detection {
        @Override
        public ContentType family() {
            return ContentType.FILE_PATH;
        }

        @Override
        public String value() {
            return path;
        }
    }

    record ShellCommand(Span span, String command, String executable, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.SHELL_COMMAND;
        }

        @Override
        public String value() {
            return command;
        }
    }

    record Code(Span span, String code, CodeLanguage language, double confidence) implements Detection {
        @Override
        public ContentType family() {
            return ContentType.CODE;
        }

        @Override
        public String value() {
            return code;
        }
    }

    record Prose(Span span, int wordCount, int estimatedReadingTimeSeconds, double confidence)
            implements Detection {
        @Override
        public ContentType family() {
            return ContentType.PROSE;
        }

        @Override
        public String value() {
            return "";
        }
    }
}
