/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/** Top-level keys of a metadata document and the content family each one holds. */
public enum MetadataFamily {
    EMAILS("emails", ContentType.EMAIL, d -> !d.emails().isEmpty()),
    URLS("urls", ContentType.URL, d -> !d.urls().isEmpty()),
    PHONE_NUMBERS("phoneNumbers", ContentType.PHONE_NUMBER, d -> !d.phoneNumbers().isEmpty()),
    IP_ADDRESSES("ipAddresses", ContentType.IP_ADDRESS, d -> !d.ipAddresses().isEmpty()),
    UUIDS("uuids", ContentType.UUID, d -> !d.uuids().isEmpty()),
    HASHES("hashes", ContentType.HASH, d -> !d.hashes().isEmpty()),
    API_KEYS("apiKeys", ContentType.API_KEY, d -> !d.apiKeys().isEmpty()),
    JWT("jwt", ContentType.JWT, d -> !d.jwt().isEmpty()),
    ENV("env", ContentType.ENV_VAR, d -> d.env() != null),
    FILE_PATHS("filePaths", ContentType.FILE_PATH, d -> !d.filePaths().isEmpty()),
    SHELL_COMMANDS("shellCommands", ContentType.SHELL_COMMAND, d -> !d.shellCommands().isEmpty()),
    CODE("code", ContentType.CODE, d -> !d.code().isEmpty()),
    PROSE("prose", ContentType.PROSE, d -> d.prose() != null);

    /** Families whose items are individually extractable, in interleaving order. */
    public static final List<MetadataFamily> EXTRACTION_ORDER = List.of(
            EMAILS, URLS, PHONE_NUMBERS, IP_ADDRESSES, UUIDS, HASHES, API_KEYS, JWT, ENV, FILE_PATHS, SHELL_COMMANDS);

    /** Extra mask bit set when the {@code env} section is a block. */
    static final int ENV_BLOCK_BIT = 1 << values().length;

    private final String key;
    private final ContentType type;
    private final Predicate<MetadataDocument> present;

    MetadataFamily(String key, ContentType type, Predicate<MetadataDocument> present) {
        this.key = key;
        this.type = type;
        this.present = present;
    }

    public String key() {
        return key;
    }

    public ContentType type() {
        return type;
    }

    /** The quoted key as it appears in serialized JSON. */
    String marker() {
        return "\"" + key + "\"";
    }

    int bit() {
        return 1 << ordinal();
    }

    boolean isPresentIn(MetadataDocument doc) {
        return present.test(doc);
    }

    /** Family holding items of the given type; {@code envVarBlock} maps to {@link #ENV}. */
    public static Optional<MetadataFamily> of(ContentType type) {
        if (type == ContentType.ENV_VAR_BLOCK) return Optional.of(ENV);
        for (MetadataFamily f : values()) {
            if (f.type == type) return Optional.of(f);
        }
        return Optional.empty();
    }
}
