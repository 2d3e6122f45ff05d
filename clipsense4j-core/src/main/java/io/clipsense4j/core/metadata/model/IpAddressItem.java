/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IpAddressItem(
        String address,
        String version,
        @JsonProperty("isPrivate") boolean privateRange,
        @JsonProperty("isLoopback") boolean loopback,
        @JsonProperty("isLinkLocal") boolean linkLocal,
        @JsonProperty("isMulticast") boolean multicast,
        double confidence) {}
