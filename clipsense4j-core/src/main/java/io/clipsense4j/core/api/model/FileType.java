/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse file category derived from a path's extension. */
public enum FileType {
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    CODE,
    ARCHIVE,
    DATA,
    EXECUTABLE,
    FONT,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FileType fromWireName(String name) {
        if (name == null) return OTHER;
        for (FileType t : values()) {
            if (t.wireName().equals(name)) return t;
        }
        return OTHER;
    }
}
