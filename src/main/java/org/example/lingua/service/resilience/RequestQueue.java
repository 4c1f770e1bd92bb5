package org.example.lingua.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * FIFO task queue that bounds both the number of tasks running at once and the
 * number of task starts inside a trailing time window.
 * <p>
 * A single scheduler thread decides when tasks start; the tasks themselves run on a
 * fixed pool of {@code concurrency} worker threads. When the rate limit is reached
 * the scheduler checks again after {@code pollDelay}.
 */
public class RequestQueue {

    private static final Logger log = LoggerFactory.getLogger(RequestQueue.class);

    private final int concurrency;
    private final int rateLimit;
    private final long intervalMillis;
    private final long pollDelayMillis;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    private final Deque<PendingTask<?>> pending = new ArrayDeque<>();
    private final Deque<Long> startTimestamps = new ArrayDeque<>();
    private int active;
    private boolean pollScheduled;
    private boolean shutdown;

    public RequestQueue(int concurrency, int rateLimit, Duration interval, Duration pollDelay, Clock clock) {
        if (concurrency < 1 || rateLimit < 1) {
            throw new IllegalArgumentException("concurrency and rateLimit must be at least 1");
        }
        this.concurrency = concurrency;
        this.rateLimit = rateLimit;
        this.intervalMillis = interval.toMillis();
        this.pollDelayMillis = Math.max(1, pollDelay.toMillis());
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("generation-queue-scheduler"));
        this.workers = Executors.newFixedThreadPool(concurrency, namedThreads("generation-queue-worker"));
    }

    public <T> CompletableFuture<T> add(Supplier<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        synchronized (this) {
            if (shutdown) {
                future.completeExceptionally(new IllegalStateException("Request queue is shut down"));
                return future;
            }
            pending.addLast(new PendingTask<>(task, future));
        }
        scheduleDrain();
        return future;
    }

    private void scheduleDrain() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
        }
        try {
            scheduler.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.debug("Request queue scheduler stopped, drain skipped");
        }
    }

    private void drain() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            long now = clock.millis();
            pruneTimestamps(now);
            while (!pending.isEmpty() && active < concurrency) {
                if (startTimestamps.size() >= rateLimit) {
                    if (!pollScheduled) {
                        pollScheduled = true;
                        scheduler.schedule(this::pollAgain, pollDelayMillis, TimeUnit.MILLISECONDS);
                    }
                    return;
                }
                start(pending.pollFirst(), now);
            }
        }
    }

    private void pollAgain() {
        synchronized (this) {
            pollScheduled = false;
        }
        drain();
    }

    private void pruneTimestamps(long now) {
        while (!startTimestamps.isEmpty() && now - startTimestamps.peekFirst() >= intervalMillis) {
            startTimestamps.pollFirst();
        }
    }

    private void start(PendingTask<?> task, long now) {
        startTimestamps.addLast(now);
        active++;
        workers.execute(() -> {
            try {
                task.run();
            } finally {
                synchronized (this) {
                    active--;
                }
                scheduleDrain();
            }
        });
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized int getActiveCount() {
        return active;
    }

    public void shutdown() {
        List<PendingTask<?>> abandoned;
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            abandoned = List.copyOf(pending);
            pending.clear();
        }
        scheduler.shutdownNow();
        workers.shutdown();
        for (PendingTask<?> task : abandoned) {
            task.future.completeExceptionally(new IllegalStateException("Request queue is shut down"));
        }
        if (!abandoned.isEmpty()) {
            log.warn("Request queue shut down with {} pending tasks", abandoned.size());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PendingTask<T>(Supplier<T> task, CompletableFuture<T> future) {

        void run() {
            try {
                future.complete(task.get());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }
    }
}
