package com.search.negatives.batch;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.logging.LogContext;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.metrics.NoOpMetricsService;
import com.search.negatives.tracing.NoOpTracingService;
import com.search.negatives.tracing.Span;
import com.search.negatives.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent units through the {@link UnitPipeline} on a fixed worker pool.
 *
 * <p>Each run gets its own pool of {@code parallelism} threads draining a bounded
 * queue. Submission waits for a free queue slot, so memory stays proportional to
 * {@code parallelism + queueCapacity} units in flight. A unit the pool still refuses
 * gets an INTERNAL outcome instead of failing the batch.</p>
 *
 * <p>Every unit gets a {@link CancellationToken} whose deadline starts when a worker
 * picks the unit up. The pipeline checks it between records and candidates, and once
 * more before publishing, and stops with a TIMEOUT outcome. A unit still running after its deadline plus the hard-stop
 * grace is interrupted and abandoned; its late result is discarded.</p>
 *
 * <p>A failing unit never affects its siblings. The report lists one outcome per unit
 * in submission order, regardless of completion order.</p>
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private static final long POLL_MILLIS = 50;

    private final UnitPipeline pipeline;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public BatchOrchestrator(UnitPipeline pipeline) {
        this(pipeline, new NoOpMetricsService(), new NoOpTracingService());
    }

    public BatchOrchestrator(UnitPipeline pipeline, MetricsService metricsService, TracingService tracingService) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Runs a batch with the given options.
     *
     * @throws IllegalArgumentException if two units share an id
     */
    public BatchReport run(List<BatchUnit> units, BatchOptions options) {
        Objects.requireNonNull(units, "units is required");
        BatchOptions opts = options != null ? options : BatchOptions.defaults();
        checkUniqueIds(units);

        String batchId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        metricsService.recordBatchSize(units.size());

        try (LogContext ctx = LogContext.forBatch(batchId);
             Span span = tracingService.startSpan(TracingService.BATCH_SPAN, Map.of("batch.id", batchId))) {
            span.setAttribute("batch.units", units.size());
            span.setAttribute("batch.parallelism", opts.parallelism());
            log.info("batch.started batchId={} units={} parallelism={} unitTimeoutMs={}",
                    batchId, units.size(), opts.parallelism(), opts.unitTimeout().toMillis());

            List<UnitOutcome> outcomes = units.isEmpty()
                    ? List.of()
                    : execute(batchId, units, opts);

            BatchReport report = new BatchReport(batchId, outcomes,
                    Duration.ofNanos(System.nanoTime() - start));
            span.setAttribute("batch.failed", report.failureCount());
            span.setAttribute("batch.success_rate", report.successRate());
            span.setStatus(report.failureCount() == 0 ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            log.info("batch.completed batchId={} status={} succeeded={} failed={} successRate={} durationMs={}",
                    batchId, report.status(), report.successCount(), report.failureCount(),
                    String.format(Locale.ROOT, "%.1f", report.successRate()), report.duration().toMillis());
            return report;
        }
    }

    private List<UnitOutcome> execute(String batchId, List<BatchUnit> units, BatchOptions opts) {
        Semaphore queueSlots = new Semaphore(opts.queueCapacity());
        UnitExecutor executor = new UnitExecutor(opts, queueSlots, new WorkerThreadFactory(batchId));
        List<UnitTask> tasks = new ArrayList<>(units.size());

        try {
            for (BatchUnit unit : units) {
                UnitTask task = new UnitTask(batchId, unit, opts.unitTimeout());
                while (!queueSlots.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    reapOverdue(tasks, opts);
                }
                try {
                    task.future = executor.submit(task::call);
                } catch (RejectedExecutionException e) {
                    queueSlots.release();
                    log.error("batch.unit.rejected unitId={} error={}", unit.unitId(), e.toString());
                    task.rejected = e;
                }
                tasks.add(task);
            }

            List<UnitOutcome> outcomes = new ArrayList<>(tasks.size());
            for (UnitTask task : tasks) {
                outcomes.add(await(task, tasks, opts));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("batch.interrupted batchId={} submitted={}", batchId, tasks.size());
            List<UnitOutcome> outcomes = new ArrayList<>(units.size());
            for (int i = 0; i < units.size(); i++) {
                if (i < tasks.size()) {
                    tasks.get(i).abandon();
                    outcomes.add(tasks.get(i).completedOr(ErrorKind.INTERNAL, "Batch interrupted"));
                } else {
                    outcomes.add(UnitOutcome.failure(units.get(i).unitId(), ErrorKind.INTERNAL,
                            "Batch interrupted before unit was submitted", Duration.ZERO));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private UnitOutcome await(UnitTask task, List<UnitTask> all, BatchOptions opts) throws InterruptedException {
        if (task.rejected != null) {
            return UnitOutcome.failure(task.unit.unitId(), ErrorKind.INTERNAL,
                    "Unit could not be scheduled: " + task.rejected.getMessage(), Duration.ZERO);
        }
        while (true) {
            try {
                return task.future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                reapOverdue(all, opts);
            } catch (CancellationException e) {
                return task.timedOut();
            } catch (ExecutionException e) {
                // UnitTask converts exceptions to outcomes; only Errors get here
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("batch.unit.crashed unitId={} error={}", task.unit.unitId(), cause.toString());
                return UnitOutcome.failure(task.unit.unitId(), ErrorKind.INTERNAL,
                        String.valueOf(cause.getMessage()), task.elapsed());
            }
        }
    }

    private void reapOverdue(List<UnitTask> tasks, BatchOptions opts) {
        Duration hardLimit = opts.unitTimeout().plus(opts.hardStopGrace());
        for (UnitTask task : tasks) {
            if (task.isOverdue(hardLimit)) {
                log.warn("batch.unit.abandoned unitId={} hardLimitMs={}", task.unit.unitId(), hardLimit.toMillis());
                task.abandon();
            }
        }
    }

    private static void checkUniqueIds(List<BatchUnit> units) {
        Set<String> seen = new HashSet<>();
        for (BatchUnit unit : units) {
            Objects.requireNonNull(unit, "units must not contain null");
            if (!seen.add(unit.unitId())) {
                throw new IllegalArgumentException("Duplicate unit id: " + unit.unitId());
            }
        }
    }

    /**
     * One submitted unit plus the state the collector needs to time it out.
     */
    private final class UnitTask {
        private final String batchId;
        private final BatchUnit unit;
        private final Duration timeout;
        private volatile CancellationToken token;
        private volatile long startedNanos;
        private volatile Future<UnitOutcome> future;
        private RejectedExecutionException rejected;

        UnitTask(String batchId, BatchUnit unit, Duration timeout) {
            this.batchId = batchId;
            this.unit = unit;
            this.timeout = timeout;
        }

        UnitOutcome call() {
            startedNanos = System.nanoTime();
            CancellationToken unitToken = CancellationToken.withTimeout(timeout);
            token = unitToken;
            try (LogContext ctx = LogContext.forUnit(batchId, unit.unitId());
                 Span span = tracingService.startSpan(TracingService.UNIT_SPAN, Map.of("unit.id", unit.unitId()))) {
                UnitOutcome outcome = runUnit(unitToken, span);
                metricsService.recordUnitOutcome(outcome.isSuccess() ? "success" : outcome.errorKind().name().toLowerCase(Locale.ROOT),
                        outcome.duration());
                return outcome;
            }
        }

        private UnitOutcome runUnit(CancellationToken unitToken, Span span) {
            try {
                FilterResult result = pipeline.run(unit, unitToken);
                span.setAttribute("unit.terms", result.summary().totalTerms());
                span.setAttribute("unit.excluded", result.summary().excludedCount());
                span.setStatus(Span.SpanStatus.OK);
                log.info("batch.unit.completed unitId={} terms={} excluded={} candidates={} durationMs={}",
                        unit.unitId(), result.summary().totalTerms(), result.summary().excludedCount(),
                        result.candidates().size(), elapsed().toMillis());
                return UnitOutcome.success(unit.unitId(), result, elapsed());
            } catch (RuntimeException e) {
                ErrorKind kind = ErrorKind.classify(e);
                span.fail(e);
                if (kind == ErrorKind.INTERNAL) {
                    log.error("batch.unit.failed unitId={} errorKind={} error={}", unit.unitId(), kind, e.toString(), e);
                } else {
                    log.warn("batch.unit.failed unitId={} errorKind={} error={}", unit.unitId(), kind, e.getMessage());
                }
                return UnitOutcome.failure(unit.unitId(), kind, e.getMessage(), elapsed());
            }
        }

        boolean isOverdue(Duration hardLimit) {
            long started = startedNanos;
            return started != 0 && future != null && !future.isDone()
                    && System.nanoTime() - started > hardLimit.toNanos();
        }

        void abandon() {
            CancellationToken t = token;
            if (t != null) {
                t.cancel();
            }
            if (future != null) {
                future.cancel(true);
            }
        }

        UnitOutcome timedOut() {
            return UnitOutcome.failure(unit.unitId(), ErrorKind.TIMEOUT,
                    "Unit exceeded " + timeout.toMillis() + " ms and was abandoned", elapsed());
        }

        UnitOutcome completedOr(ErrorKind kind, String message) {
            if (future != null && future.isDone() && !future.isCancelled()) {
                try {
                    return future.get();
                } catch (InterruptedException | ExecutionException e) {
                    return UnitOutcome.failure(unit.unitId(), kind, message, elapsed());
                }
            }
            return UnitOutcome.failure(unit.unitId(), kind, message, elapsed());
        }

        Duration elapsed() {
            long started = startedNanos;
            return started == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started);
        }
    }

    /**
     * Fixed pool that hands a queue slot back as soon as a worker takes a task off the queue.
     * A submitter holding a slot therefore always finds room in the queue.
     */
    private static final class UnitExecutor extends ThreadPoolExecutor {
        private final Semaphore queueSlots;

        UnitExecutor(BatchOptions opts, Semaphore queueSlots, ThreadFactory threadFactory) {
            super(opts.parallelism(), opts.parallelism(), 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(opts.queueCapacity()), threadFactory);
            this.queueSlots = queueSlots;
        }

        @Override
        protected void beforeExecute(Thread t, Runnable r) {
            queueSlots.release();
            super.beforeExecute(t, r);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String batchId) {
            this.prefix = "negatives-batch-" + batchId.substring(0, Math.min(8, batchId.length())) + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
