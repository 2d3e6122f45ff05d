/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.metadata.model.EnvAssignment;
import io.clipsense4j.core.metadata.model.EnvSection;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes metadata documents and answers containment queries on their
 * serialized form.
 *
 * <p>Reading never throws: blank or malformed JSON is an empty document. Containment
 * checks first look for the family's quoted key in the raw string and only parse when it
 * is there; the resulting family bitmask is cached per document.</p>
 */
@Slf4j
public final class MetadataCodec {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final FamilyMaskCache cache;

    public MetadataCodec() {
        this(FamilyMaskCache.bounded(FamilyMaskCache.DEFAULT_CAPACITY));
    }

    public MetadataCodec(FamilyMaskCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public String serialize(MetadataDocument document) {
        return write(document == null ? MetadataDocument.empty() : document);
    }

    /** Metadata of one record of a split environment block. */
    public String serialize(EnvAssignment assignment) {
        return write(Objects.requireNonNull(assignment, "assignment"));
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MetadataCodecException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public MetadataDocument parse(String json) {
        if (json == null || json.isBlank()) return MetadataDocument.empty();
        try {
            MetadataDocument doc = MAPPER.readValue(json, MetadataDocument.class);
            return doc == null ? MetadataDocument.empty() : doc;
        } catch (JsonProcessingException e) {
            log.debug("Unreadable metadata treated as empty: {}", e.getOriginalMessage());
            return MetadataDocument.empty();
        }
    }

    /** Whether the document holds at least one item of the given family. */
    public boolean containsFamily(ContentType type, String json) {
        if (type == null || json == null || json.isEmpty()) return false;
        Optional<MetadataFamily> family = MetadataFamily.of(type);
        if (family.isEmpty() || !json.contains(family.get().marker())) return false;
        int mask = cache.maskOf(json, this::computeMask);
        int bit = type == ContentType.ENV_VAR_BLOCK ? MetadataFamily.ENV_BLOCK_BIT : family.get().bit();
        return (mask & bit) != 0;
    }

    int computeMask(String json) {
        MetadataDocument doc = parse(json);
        int mask = 0;
        for (MetadataFamily f : MetadataFamily.values()) {
            if (f.isPresentIn(doc)) mask |= f.bit();
        }
        if (doc.env() != null && doc.env().block()) mask |= MetadataFamily.ENV_BLOCK_BIT;
        return mask;
    }

    public List<ExtractedValue> extractValues(ContentType type, String json) {
        return extractValues(type, json, Integer.MAX_VALUE);
    }

    /** Values of one family in document order, at most {@code limit} of them. */
    public List<ExtractedValue> extractValues(ContentType type, String json, int limit) {
        if (type == null || limit <= 0) return List.of();
        List<ExtractedValue> all = values(type, parse(json));
        return all.size() <= limit ? all : List.copyOf(all.subList(0, limit));
    }

    public List<ExtractedValue> extractAll(String json) {
        return extractAll(json, Integer.MAX_VALUE);
    }

    /**
     * Values of every extractable family, interleaved round-robin (first email, first URL,
     * ..., then second email...) so a small {@code limit} still shows each family.
     */
    public List<ExtractedValue> extractAll(String json, int limit) {
        if (limit <= 0) return List.of();
        MetadataDocument doc = parse(json);
        List<Iterator<ExtractedValue>> queues = new ArrayList<>();
        for (MetadataFamily f : MetadataFamily.EXTRACTION_ORDER) {
            List<ExtractedValue> values = values(f.type(), doc);
            if (!values.isEmpty()) queues.add(values.iterator());
        }
        List<ExtractedValue> out = new ArrayList<>();
        while (!queues.isEmpty() && out.size() < limit) {
            Iterator<Iterator<ExtractedValue>> it = queues.iterator();
            while (it.hasNext() && out.size() < limit) {
                Iterator<ExtractedValue> q = it.next();
                out.add(q.next());
                if (!q.hasNext()) it.remove();
            }
        }
        return List.copyOf(out);
    }

    public int countItems(ContentType type, String json) {
        if (type == null) return 0;
        MetadataDocument doc = parse(json);
        return switch (type) {
            case EMAIL -> doc.emails().size();
            case URL -> doc.urls().size();
            case PHONE_NUMBER -> doc.phoneNumbers().size();
            case IP_ADDRESS -> doc.ipAddresses().size();
            case UUID -> doc.uuids().size();
            case HASH -> doc.hashes().size();
            case API_KEY -> doc.apiKeys().size();
            case JWT -> doc.jwt().size();
            case ENV_VAR -> doc.env() == null ? 0 : doc.env().vars().size();
            case ENV_VAR_BLOCK -> doc.env() != null && doc.env().block() ? doc.env().vars().size() : 0;
            case FILE_PATH -> doc.filePaths().size();
            case SHELL_COMMAND -> doc.shellCommands().size();
            case CODE -> doc.code().size();
            default -> 0;
        };
    }

    private static List<ExtractedValue> values(ContentType type, MetadataDocument doc) {
        List<ExtractedValue> out = new ArrayList<>();
        switch (type) {
            case EMAIL -> doc.emails().forEach(e -> out.add(new ExtractedValue(type, e.email())));
            case URL -> doc.urls().forEach(u -> out.add(new ExtractedValue(type, u.url(), orElse(u.domain(), u.url()))));
            case PHONE_NUMBER -> doc.phoneNumbers().forEach(p -> out.add(new ExtractedValue(type, p.number())));
            case IP_ADDRESS -> doc.ipAddresses().forEach(ip -> out.add(new ExtractedValue(
                    type,
                    ip.address(),
                    ip.version() == null || ip.version().isEmpty()
                            ? ip.address()
                            : ip.address() + " (" + ip.version().toUpperCase(Locale.ROOT) + ")")));
            case UUID -> doc.uuids().forEach(u -> out.add(new ExtractedValue(type, u.uuid())));
            case HASH -> doc.hashes().forEach(h -> out.add(new ExtractedValue(
                    type, h.hash(), h.kind() == null ? h.hash() : h.kind().toUpperCase(Locale.ROOT) + ": " + h.hash())));
            case API_KEY -> doc.apiKeys().forEach(k -> out.add(new ExtractedValue(
                    type, k.key(), k.provider() == null ? k.key() : k.provider() + ": " + k.key())));
            case JWT -> doc.jwt().forEach(j -> out.add(new ExtractedValue(
                    type, j.token(), Boolean.TRUE.equals(j.expired()) ? "JWT (expired)" : "JWT")));
            case ENV_VAR -> envValues(doc.env(), false, out);
            case ENV_VAR_BLOCK -> envValues(doc.env(), true, out);
            case FILE_PATH -> doc.filePaths().forEach(f -> out.add(new ExtractedValue(type, f.path())));
            case SHELL_COMMAND -> doc.shellCommands().forEach(c -> out.add(new ExtractedValue(
                    type, c.command(), c.executable() == null ? c.command() : c.executable() + ": " + c.command())));
            default -> {
                // families without individual values
            }
        }
        return out;
    }

    private static void envValues(EnvSection env, boolean blockOnly, List<ExtractedValue> out) {
        if (env == null || (blockOnly && !env.block())) return;
        env.vars().forEach(v -> {
            String value = v.value() == null || v.value().isEmpty() ? v.key() : v.key() + "=" + v.value();
            out.add(new ExtractedValue(ContentType.ENV_VAR, value));
        });
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
