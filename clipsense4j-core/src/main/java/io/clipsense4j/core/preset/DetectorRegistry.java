/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.preset;

import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.detect.*;
import java.util.*;

/**
 * Builds the {@link Detector} cascade for a set of enabled families.
 *
 * <h3>Detector ordering</h3>
 * The list order is the classification priority; the first family whose best detection
 * clears its threshold becomes the primary type.
 * <ul>
 *   <li><b>1.</b> Secrets and tokens: jwt, apiKey</li>
 *   <li><b>2.</b> Assignments: envVar</li>
 *   <li><b>3.</b> Exact-shape identifiers: email, uuid, hash, ipAddress, phoneNumber, url</li>
 *   <li><b>4.</b> Structured text: code, shellCommand, filePath</li>
 *   <li><b>5.</b> Natural language: prose</li>
 * </ul>
 */
public final class DetectorRegistry {

    /** Families that can have a detector, in priority order. */
    public static final List<ContentType> PRIORITY = List.of(
            ContentType.JWT,
            ContentType.API_KEY,
            ContentType.ENV_VAR,
            ContentType.EMAIL,
            ContentType.UUID,
            ContentType.HASH,
            ContentType.IP_ADDRESS,
            ContentType.PHONE_NUMBER,
            ContentType.URL,
            ContentType.CODE,
            ContentType.SHELL_COMMAND,
            ContentType.FILE_PATH,
            ContentType.PROSE);

    private static final Map<ContentType, Double> THRESHOLDS = thresholds();

    /** Every detectable family. */
    public static EnumSet<ContentType> defaultTypes() {
        return EnumSet.copyOf(PRIORITY);
    }

    /** Minimum best-detection confidence for a family to become the primary type. */
    public static double threshold(ContentType family) {
        Double t = THRESHOLDS.get(family);
        if (t == null) throw new IllegalArgumentException("no detector family: " + family);
        return t;
    }

    /**
     * Build detectors in a deterministic order.
     *
     * @param types  the families enabled in config (null/empty means all)
     * @param config host collaborators (never null)
     * @return immutable list of active detectors, highest priority first
     */
    public List<Detector<?>> build(Collection<ContentType> types, DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig cannot be null");
        EnumSet<ContentType> enabled =
                (types == null || types.isEmpty()) ? defaultTypes() : EnumSet.copyOf(types);

        List<Detector<?>> out = new ArrayList<>();
        for (ContentType family : PRIORITY) {
            if (enabled.contains(family)) out.add(create(family, config));
        }
        return List.copyOf(out);
    }

    private static Detector<?> create(ContentType family, DetectorConfig config) {
        return switch (family) {
            case JWT -> new JwtDetector(config.clock());
            case API_KEY -> new ApiKeyDetector();
            case ENV_VAR -> new EnvVarDetector();
            case EMAIL -> new EmailDetector();
            case UUID -> new UuidDetector();
            case HASH -> new HashDetector();
            case IP_ADDRESS -> new IpAddressDetector();
            case PHONE_NUMBER -> new PhoneNumberDetector();
            case URL -> new UrlDetector();
            case CODE -> new CodeDetector();
            case SHELL_COMMAND -> new ShellCommandDetector();
            case FILE_PATH -> new FilePathDetector(config.pathProbe());
            case PROSE -> new ProseDetector();
            default -> throw new IllegalArgumentException("no detector family: " + family);
        };
    }

    private static Map<ContentType, Double> thresholds() {
        Map<ContentType, Double> m = new EnumMap<>(ContentType.class);
        m.put(ContentType.JWT, 0.9);
        m.put(ContentType.API_KEY, 0.6);
        m.put(ContentType.ENV_VAR, 0.8);
        m.put(ContentType.EMAIL, 0.9);
        m.put(ContentType.UUID, 0.8);
        m.put(ContentType.HASH, 0.8);
        m.put(ContentType.IP_ADDRESS, 0.8);
        m.put(ContentType.PHONE_NUMBER, 0.8);
        m.put(ContentType.URL, 0.9);
        m.put(ContentType.CODE, 0.6);
        m.put(ContentType.SHELL_COMMAND, 0.5);
        m.put(ContentType.FILE_PATH, 0.6);
        m.put(ContentType.PROSE, 0.6);
        return Collections.unmodifiableMap(m);
    }
}
