/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Metadata attached to one record of a split environment block. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvAssignment(String key, @JsonProperty("isExported") boolean exported) {}
