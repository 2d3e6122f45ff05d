/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.spring;

import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.metadata.FamilyMaskCache;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "clipsense")
public class ClipsenseEndpoint {

    private final MicrometerReporter reporter;
    private final FamilyMaskCache maskCache;
    private final List<ContentType> families;

    public ClipsenseEndpoint(MicrometerReporter reporter, FamilyMaskCache maskCache, List<ContentType> families) {
        this.reporter = reporter;
        this.maskCache = maskCache;
        this.families = List.copyOf(families);
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("detectors", families.stream().map(ContentType::wireName).toList());
        m.put("metadataCacheSize", maskCache.size());
        m.put("recentFindings", reporter.recentFindings());
        return m;
    }
}
