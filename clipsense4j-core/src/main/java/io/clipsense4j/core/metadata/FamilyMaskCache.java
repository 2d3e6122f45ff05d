/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.Executor;
import java.util.function.ToIntFunction;

/**
 * Bounded, thread-safe map from a serialized metadata document to the bitmask of families
 * it contains. Purely an optimisation: a miss just recomputes the mask.
 */
public final class FamilyMaskCache {
    public static final int DEFAULT_CAPACITY = 512;

    private final Cache<String, Integer> cache;

    private FamilyMaskCache(Cache<String, Integer> cache) {
        this.cache = cache;
    }

    public static FamilyMaskCache bounded(int capacity) {
        return new FamilyMaskCache(builder(capacity).build());
    }

    /** Variant whose maintenance runs on the given executor (tests pass {@code Runnable::run}). */
    public static FamilyMaskCache bounded(int capacity, Executor executor) {
        return new FamilyMaskCache(builder(capacity).executor(executor).build());
    }

    private static Caffeine<Object, Object> builder(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        return Caffeine.newBuilder().maximumSize(capacity);
    }

    int maskOf(String document, ToIntFunction<String> compute) {
        return cache.get(document, compute::applyAsInt);
    }

    Integer cached(String document) {
        return cache.getIfPresent(document);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
