/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CodeLanguage {
    SWIFT("swift"),
    PYTHON("python"),
    JAVASCRIPT("javaScript"),
    TYPESCRIPT("typeScript"),
    GO("go"),
    RUST("rust"),
    JAVA("java"),
    C_CPP("cCpp"),
    RUBY("ruby"),
    SQL("sql"),
    JSON("json"),
    YAML("yaml"),
    HTML("html"),
    CSS("css"),
    SHELL("shell"),
    UNKNOWN("unknown");

    private final String wireName;

    CodeLanguage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static CodeLanguage fromWireName(String name) {
        if (name == null) return UNKNOWN;
        for (CodeLanguage l : values()) {
            if (l.wireName.equals(name)) return l;
        }
        return UNKNOWN;
    }
}
