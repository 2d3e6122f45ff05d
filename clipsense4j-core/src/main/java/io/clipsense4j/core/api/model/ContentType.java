/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of content kinds a captured payload can be classified as. */
public enum ContentType {
    TEXT("text"),
    EMAIL("email"),
    PHONE_NUMBER("phoneNumber"),
    IP_ADDRESS("ipAddress"),
    UUID("uuid"),
    HASH("hash"),
    JWT("jwt"),
    API_KEY("apiKey"),
    ENV_VAR("envVar"),
    ENV_VAR_BLOCK("envVarBlock"),
    PROSE("prose"),
    IMAGE("image"),
    SCREENSHOT("screenshot"),
    FILE_PATH("filePath"),
    URL("url"),
    CODE("code"),
    SHELL_COMMAND("shellCommand"),
    UNKNOWN("unknown");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Binary payloads skip text classification entirely. */
    public boolean isBinary() {
        return this == IMAGE || this == SCREENSHOT;
    }

    @JsonCreator
    public static ContentType fromWireName(String name) {
        if (name == null) return UNKNOWN;
        for (ContentType t : values()) {
            if (t.wireName.equals(name) || t.name().equalsIgnoreCase(name)) return t;
        }
        return UNKNOWN;
    }
}
