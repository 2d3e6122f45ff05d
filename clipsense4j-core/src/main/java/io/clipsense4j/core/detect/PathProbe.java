/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/** Answers whether a filesystem path exists. Implementations must be thread-safe. */
@FunctionalInterface
public interface PathProbe {

    Duration DEFAULT_TIMEOUT = Duration.ofMillis(50);

    boolean exists(String path);

    /** Probe that never touches the filesystem. */
    static PathProbe none() {
        return path -> false;
    }

    /** Stats on a small daemon pool; a stat slower than {@code timeout} counts as missing. */
    static PathProbe timeoutGuarded(Duration timeout) {
        return new TimeoutGuarded(timeout);
    }

    static PathProbe defaultProbe() {
        return timeoutGuarded(DEFAULT_TIMEOUT);
    }

    @Slf4j
    final class TimeoutGuarded implements PathProbe {
        private static final AtomicInteger THREADS = new AtomicInteger();
        private static final ExecutorService POOL = new ThreadPoolExecutor(
                0, 4, 30, TimeUnit.SECONDS, new SynchronousQueue<>(), TimeoutGuarded::daemon);

        private final long timeoutMillis;

        TimeoutGuarded(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeoutMillis = timeout.toMillis();
        }

        @Override
        public boolean exists(String path) {
            Future<Boolean> stat;
            try {
                stat = POOL.submit(() -> Files.exists(Path.of(path)));
            } catch (RejectedExecutionException e) {
                log.debug("Path probe pool saturated, treating {} as missing", path);
                return false;
            }
            try {
                return stat.get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                stat.cancel(true);
                log.debug("Stat of {} exceeded {} ms", path, timeoutMillis);
                return false;
            } catch (ExecutionException e) {
                log.debug("Stat of {} failed: {}", path, e.getCause().toString());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private static Thread daemon(Runnable r) {
            Thread t = new Thread(r, "clipsense4j-path-probe-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
