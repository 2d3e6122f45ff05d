/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.classify;

import io.clipsense4j.core.api.ClassificationOptions;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ClassificationOutput;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.DecodeResult;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.ExtractedItem;
import io.clipsense4j.core.api.model.Finding;
import io.clipsense4j.core.api.model.SpanSet;
import io.clipsense4j.core.api.model.SplitEntry;
import io.clipsense4j.core.detect.EnvVarDetector;
import io.clipsense4j.core.encoding.EncodingResolver;
import io.clipsense4j.core.metadata.MetadataCodec;
import io.clipsense4j.core.metadata.model.EnvAssignment;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import io.clipsense4j.core.preset.DetectorRegistry;
import io.clipsense4j.core.report.Reporter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides the primary type of a payload and, optionally, extracts everything else it
 * contains.
 *
 * <p>The payload is first unwrapped by the {@link EncodingResolver}. An environment block
 * in which every line parsed is split into one record per assignment. Anything else goes
 * through the detector cascade in priority order: the first family whose best detection
 * clears its threshold becomes the primary type. Assignments mixed with other lines score
 * below the envVar threshold; they only win when nothing else scored higher, and are split
 * when there are at least two of them. With extraction enabled every detector runs and the
 * secondary detections become child records; otherwise the cascade stops at the primary.</p>
 *
 * <p>Detectors run sequentially; a failing detector (including one that fails to link) is
 * logged, reported and ignored. Thread-safe as long as the detectors and the reporter are.</p>
 */
@Slf4j
public final class ContentClassifier {
    static final double TEXT_CONFIDENCE = 0.5;
    static final int MIN_TEXT_LENGTH = 2;

    /** Families whose detections may not overlap a JWT. */
    private static final Set<ContentType> JWT_SUPPRESSED =
            EnumSet.of(ContentType.API_KEY, ContentType.HASH, ContentType.PHONE_NUMBER);

    private final List<Detector<?>> detectors;
    private final EnvVarDetector envDetector;
    private final EncodingResolver resolver;
    private final MetadataCodec codec;
    private final Reporter reporter;
    private final ExtractionPlanner planner;

    public ContentClassifier(
            List<Detector<?>> detectors, EncodingResolver resolver, MetadataCodec codec, Reporter reporter) {
        this.detectors = List.copyOf(detectors);
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.envDetector = this.detectors.stream()
                .filter(EnvVarDetector.class::isInstance)
                .map(EnvVarDetector.class::cast)
                .findFirst()
                .orElse(null);
        this.planner = new ExtractionPlanner(codec);
    }

    public ClassificationOutput classify(String text) {
        return classify(text, ClassificationOptions.defaults());
    }

    public ClassificationOutput classify(String text, ClassificationOptions options) {
        Objects.requireNonNull(options, "options");
        if (text == null || text.isBlank()) return ClassificationOutput.unknown("");

        DecodeResult decoding = resolver.resolve(text.strip());
        String subject = decoding.subject();

        Optional<EnvVarDetector.Analysis> env = analyzeEnv(subject);
        ClassificationOutput out = env.isPresent() && env.get().block() && clears(env.get())
                ? split(env.get(), decoding)
                : cascade(subject, decoding, options, env.orElse(null));
        report(out);
        return out;
    }

    private Optional<EnvVarDetector.Analysis> analyzeEnv(String subject) {
        if (envDetector == null) return Optional.empty();
        try {
            return envDetector.analyze(subject);
        } catch (RuntimeException | LinkageError e) {
            failed(envDetector.family(), e);
            return Optional.empty();
        }
    }

    private ClassificationOutput split(EnvVarDetector.Analysis analysis, DecodeResult decoding) {
        List<SplitEntry> entries = new ArrayList<>(analysis.vars().size());
        for (Detection.EnvVar v : analysis.vars()) {
            entries.add(new SplitEntry(
                    v.value(), ContentType.ENV_VAR, codec.serialize(new EnvAssignment(v.key(), v.exported()))));
        }
        MetadataDocument doc = new MetadataAssembler()
                .addAll(analysis.vars())
                .envBlock(true)
                .decoding(decoding)
                .build();
        log.debug("Split environment block into {} records", entries.size());
        return new ClassificationOutput(
                ContentType.ENV_VAR_BLOCK,
                analysis.confidence(),
                codec.serialize(doc),
                doc,
                decoding,
                entries,
                List.of());
    }

    private static boolean clears(EnvVarDetector.Analysis env) {
        return env.confidence() >= DetectorRegistry.threshold(ContentType.ENV_VAR);
    }

    /** Highest confidence wins; equal confidence goes to the family earlier in the priority order. */
    private static boolean outranks(double envConfidence, ContentType primary, double confidence) {
        if (primary == null) return envConfidence > TEXT_CONFIDENCE;
        if (envConfidence != confidence) return envConfidence > confidence;
        return DetectorRegistry.PRIORITY.indexOf(primary) > DetectorRegistry.PRIORITY.indexOf(ContentType.ENV_VAR);
    }

    private ClassificationOutput cascade(
            String subject, DecodeResult decoding, ClassificationOptions options, EnvVarDetector.Analysis env) {
        SpanSet jwtSpans = SpanSet.empty();
        Map<ContentType, List<? extends Detection>> found = new LinkedHashMap<>();
        ContentType primary = null;
        double confidence = 0.0;

        for (Detector<?> detector : detectors) {
            ContentType family = detector.family();
            List<? extends Detection> hits = run(detector, subject, jwtSpans);
            if (hits.isEmpty()) continue;
            found.put(family, hits);
            if (family == ContentType.JWT) hits.forEach(h -> jwtSpans.add(h.span()));
            if (primary == null) {
                double best = hits.stream().mapToDouble(Detection::confidence).max().orElse(0.0);
                if (best >= DetectorRegistry.threshold(family)) {
                    primary = family;
                    confidence = best;
                }
            }
            if (primary != null && !options.extractContent()) break;
        }

        if (env != null && !clears(env) && outranks(env.confidence(), primary, confidence)) {
            if (env.block()) return split(env, decoding);
            primary = ContentType.ENV_VAR;
            confidence = env.confidence();
            found.putIfAbsent(ContentType.ENV_VAR, env.vars());
        }

        if (primary == null) {
            primary = subject.length() < MIN_TEXT_LENGTH ? ContentType.UNKNOWN : ContentType.TEXT;
            confidence = primary == ContentType.TEXT ? TEXT_CONFIDENCE : 0.0;
        }

        MetadataAssembler assembler = new MetadataAssembler().decoding(decoding);
        List<ExtractedItem> extracted = List.of();
        if (options.extractContent()) {
            found.values().forEach(assembler::addAll);
            extracted = planner.plan(found, subject, options.maxExtractedItems());
        } else if (found.containsKey(primary)) {
            assembler.addAll(found.get(primary));
        }
        MetadataDocument doc = assembler.build();
        String json = doc.isEmpty() ? "" : codec.serialize(doc);
        return new ClassificationOutput(primary, confidence, json, doc, decoding, List.of(), extracted);
    }

    private List<? extends Detection> run(Detector<?> detector, String subject, SpanSet jwtSpans) {
        try {
            List<? extends Detection> hits = JWT_SUPPRESSED.contains(detector.family())
                    ? detector.detect(subject, jwtSpans)
                    : detector.detect(subject);
            return hits == null ? List.of() : hits;
        } catch (RuntimeException | LinkageError e) {
            failed(detector.family(), e);
            return List.of();
        }
    }

    private void failed(ContentType family, Throwable e) {
        log.warn("Detector '{}' failed and was skipped: {}", family.wireName(), e.toString());
        reporter.detectorFailed(family, e);
    }

    private void report(ClassificationOutput out) {
        List<Finding> findings = new ArrayList<>(1 + out.splitEntries().size() + out.extractedItems().size());
        findings.add(new Finding(out.primaryType(), Finding.Role.PRIMARY, out.confidence()));
        out.splitEntries().forEach(e -> findings.add(new Finding(e.contentType(), Finding.Role.SPLIT, out.confidence())));
        out.extractedItems().forEach(i -> findings.add(new Finding(i.contentType(), Finding.Role.EXTRACTED, out.confidence())));
        try {
            reporter.report(List.copyOf(findings));
        } catch (RuntimeException e) {
            log.warn("Reporter failed, findings dropped: {}", e.toString());
        }
    }
}
