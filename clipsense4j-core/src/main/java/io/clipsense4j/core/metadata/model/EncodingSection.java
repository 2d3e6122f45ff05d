/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Preview of the decode chain applied before classification. {@code encoding} is the
 * single step name, or {@code nested} when more than one step ran.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "steps is an immutable copy")
public record EncodingSection(String encoding, List<String> steps, String decodedPreview) {
    public static final String NESTED = "nested";

    public EncodingSection {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
