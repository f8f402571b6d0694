package com.search.negatives.batch;

import java.time.Duration;

/**
 * Worker pool and timeout settings for a batch run.
 *
 * @param parallelism   number of worker threads
 * @param unitTimeout   wall-clock budget per unit, measured from when the unit starts running
 * @param queueCapacity units allowed to wait for a worker before submission blocks
 * @param hardStopGrace extra time a cancelled unit gets to reach a cancellation check
 *                      before its worker is interrupted and the unit is abandoned
 */
public record BatchOptions(int parallelism, Duration unitTimeout, int queueCapacity, Duration hardStopGrace) {

    private static final Duration DEFAULT_UNIT_TIMEOUT = Duration.ofMinutes(5);
    private static final int DEFAULT_QUEUE_CAPACITY = 100;
    private static final Duration DEFAULT_HARD_STOP_GRACE = Duration.ofSeconds(1);

    public BatchOptions {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        if (unitTimeout == null || unitTimeout.isNegative() || unitTimeout.isZero()) {
            throw new IllegalArgumentException("unitTimeout must be positive");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (hardStopGrace == null || hardStopGrace.isNegative()) {
            throw new IllegalArgumentException("hardStopGrace must not be negative");
        }
    }

    public static BatchOptions of(int parallelism, Duration unitTimeout) {
        return new BatchOptions(parallelism, unitTimeout, DEFAULT_QUEUE_CAPACITY, DEFAULT_HARD_STOP_GRACE);
    }

    /**
     * One worker per core (at most 8), five minutes per unit.
     */
    public static BatchOptions defaults() {
        return of(Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors())), DEFAULT_UNIT_TIMEOUT);
    }
}
