package com.memoryfetch.memoryfetch.memories;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs descriptors through a {@link MemoryDownloadExecutor}, sequentially or on a fixed worker pool.
 *
 * <p>Pacing is applied per worker: after its own successful transfer a worker sleeps the configured
 * delay before taking more work, so the aggregate rate is about {@code concurrency / delay}.
 */
public class MemoryDownloadScheduler {

    private static final Logger log = LoggerFactory.getLogger(MemoryDownloadScheduler.class);
    private static final int PROGRESS_LOG_INTERVAL = 25;
    private static final long SHUTDOWN_WAIT_SECONDS = 30;
    private static final long COMPLETION_POLL_MILLIS = 200;

    private final int concurrency;
    private final Duration delay;
    private final Sleeper sleeper;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean running;
    private volatile ExecutorService workers;
    private volatile Thread sequentialThread;

    public MemoryDownloadScheduler(int concurrency, Duration delay, Sleeper sleeper, Clock clock) {
        if (concurrency < 1) {
            throw new IllegalArgumentException(MemoriesConstants.MSG_INVALID_CONCURRENCY.formatted(concurrency));
        }
        this.concurrency = concurrency;
        this.delay = delay == null ? Duration.ZERO : delay;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public DownloadRunSummary run(List<MemoryDescriptor> descriptors, MemoryDownloadExecutor executor) {
        RunStatistics statistics = new RunStatistics(descriptors.size());
        Instant start = clock.instant();
        running = true;
        try {
            boolean interrupted = concurrency == 1
                    ? runSequential(descriptors, executor, statistics)
                    : runParallel(descriptors, executor, statistics);
            return statistics.summary(Duration.between(start, clock.instant()), interrupted || cancelled.get());
        } finally {
            running = false;
            finished.countDown();
        }
    }

    /**
     * Stops dispatching new work, interrupts in-flight transfers and waits for the run to wind down.
     * Called from another thread, typically the shutdown hook.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        ExecutorService pool = workers;
        if (pool != null) {
            pool.shutdownNow();
        }
        Thread thread = sequentialThread;
        if (thread != null) {
            thread.interrupt();
        }
        if (running) {
            try {
                if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Download run did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private boolean runSequential(List<MemoryDescriptor> descriptors, MemoryDownloadExecutor executor,
                                  RunStatistics statistics) {
        sequentialThread = Thread.currentThread();
        try {
            for (int i = 0; i < descriptors.size(); i++) {
                if (cancelled.get()) {
                    return true;
                }
                MemoryDescriptor descriptor = descriptors.get(i);
                DownloadOutcome outcome = downloadSafely(executor, descriptor);
                statistics.record(outcome);
                logProgress(descriptor, outcome, statistics.completed(), descriptors.size());

                if (outcome == DownloadOutcome.SUCCEEDED && i < descriptors.size() - 1) {
                    sleeper.sleep(delay);
                }
            }
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Download interrupted; {} of {} memories processed", statistics.completed(), descriptors.size());
            return true;
        } finally {
            sequentialThread = null;
        }
    }

    private boolean runParallel(List<MemoryDescriptor> descriptors, MemoryDownloadExecutor executor,
                                RunStatistics statistics) {
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("memory-worker-"));
        workers = pool;
        CompletionService<DownloadOutcome> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        try {
            for (MemoryDescriptor descriptor : descriptors) {
                if (cancelled.get()) {
                    break;
                }
                completion.submit(() -> {
                    DownloadOutcome outcome = downloadSafely(executor, descriptor);
                    statistics.record(outcome);
                    logProgress(descriptor, outcome, statistics.completed(), descriptors.size());
                    if (outcome == DownloadOutcome.SUCCEEDED) {
                        sleeper.sleep(delay);
                    }
                    return outcome;
                });
                submitted++;
            }

            int collected = 0;
            while (collected < submitted) {
                Future<DownloadOutcome> done = completion.poll(COMPLETION_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    if (cancelled.get()) {
                        return true;
                    }
                    continue;
                }
                collected++;
                try {
                    done.get();
                } catch (ExecutionException ex) {
                    if (!(ex.getCause() instanceof InterruptedException)) {
                        log.error("Unexpected worker failure", ex.getCause());
                    }
                } catch (CancellationException ex) {
                    return true;
                }
            }
            return cancelled.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Download interrupted; {} of {} memories processed", statistics.completed(), descriptors.size());
            return true;
        } catch (RejectedExecutionException ex) {
            return true;
        } finally {
            pool.shutdownNow();
            awaitQuietly(pool);
            workers = null;
        }
    }

    /**
     * Any unexpected error of one descriptor counts as a failure so every descriptor is counted exactly once.
     * Interruption propagates.
     */
    private DownloadOutcome downloadSafely(MemoryDownloadExecutor executor, MemoryDescriptor descriptor)
            throws InterruptedException {
        try {
            return executor.download(descriptor);
        } catch (RuntimeException ex) {
            log.error("Error downloading {} {}", descriptor.mediaKind(), descriptor.timestamp(), ex);
            return DownloadOutcome.FAILED;
        }
    }

    private void logProgress(MemoryDescriptor descriptor, DownloadOutcome outcome, int completed, int total) {
        log.debug("[{}/{}] {} - {}: {}", completed, total, descriptor.mediaKind(), descriptor.timestamp(), outcome);
        if (completed % PROGRESS_LOG_INTERVAL == 0 || completed == total) {
            log.info("Progress: {}/{} memories processed", completed, total);
        }
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Download workers did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
