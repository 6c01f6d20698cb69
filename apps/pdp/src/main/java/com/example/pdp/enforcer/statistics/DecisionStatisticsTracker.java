package com.example.pdp.enforcer.statistics;

import com.example.pdp.config.properties.StatisticsProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Rolling success/failure counts of policy engine calls.
 *
 * <p>Outcomes are offered to a bounded queue and applied by a single consumer thread, which is the
 * only writer of the counters. The consumer publishes each window as one immutable {@link Counts} value,
 * so readers always see a matching request and failure count. Every interval the counters are reset
 * through the same queue. {@link #status()} reads the counters without touching the queue; once the failure rate exceeds
 * the threshold the tracker is tripped and stays tripped for the life of the process.</p>
 */
@Slf4j
@Component
public class DecisionStatisticsTracker {

    private enum Signal { SUCCESS, FAILURE, RESET, STOP }

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final BlockingQueue<Signal> queue;
    private final double failureThreshold;
    private final Clock clock;

    private final AtomicReference<Counts> counts;
    private final AtomicBoolean tripped = new AtomicBoolean(false);

    private final AtomicLong offered = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();

    private final Thread consumer;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public DecisionStatisticsTracker(StatisticsProperties properties) {
        this(properties, Clock.systemUTC(), true);
    }

    DecisionStatisticsTracker(StatisticsProperties properties, Clock clock, boolean scheduleResets) {
        this.queue = new ArrayBlockingQueue<>(properties.queueCapacity());
        this.failureThreshold = properties.failureThreshold();
        this.clock = clock;
        this.counts = new AtomicReference<>(Counts.empty(clock.instant()));

        this.consumer = new Thread(this::consume, "pdp-statistics-consumer");
        this.consumer.setDaemon(true);
        this.consumer.start();

        if (scheduleResets) {
            long intervalMillis = properties.interval().toMillis();
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pdp-statistics-reset");
                t.setDaemon(true);
                return t;
            });
            this.scheduler.scheduleAtFixedRate(this::resetWindow, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        } else {
            this.scheduler = null;
        }

        log.info("Decision statistics tracker started (interval={}, threshold={})",
                properties.interval(), failureThreshold);
    }

    public void reportSuccess() {
        offer(Signal.SUCCESS);
    }

    public void reportFailure() {
        offer(Signal.FAILURE);
    }

    /**
     * Starts a new window: counters go back to zero, the tripped flag is kept.
     */
    public void resetWindow() {
        offer(Signal.RESET);
    }

    /**
     * Evaluates the current window and returns whether the tracker is tripped.
     */
    public boolean status() {
        return evaluate(counts.get());
    }

    @NonNull
    public StatisticsWindow snapshot() {
        Counts current = counts.get();
        boolean isTripped = evaluate(current);
        return new StatisticsWindow(current.requests(), current.failures(), current.windowStart(), isTripped);
    }

    private boolean evaluate(Counts current) {
        double rate = current.failureRate();
        if (rate > failureThreshold && tripped.compareAndSet(false, true)) {
            log.error("Policy engine failure rate {} exceeded threshold {} ({} of {} requests failed)",
                    String.format("%.3f", rate), failureThreshold, current.failures(), current.requests());
        }
        return tripped.get();
    }

    /**
     * Waits until every outcome offered so far has been applied.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitProcessed(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (processed.get() < offered.get()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
        }
        return true;
    }

    /**
     * Stops the reset schedule, applies every queued outcome, then stops the consumer.
     */
    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        try {
            queue.put(Signal.STOP);
            consumer.join(SHUTDOWN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining decision statistics");
        }
        Counts last = counts.get();
        log.info("Decision statistics tracker stopped (requests={}, failures={}, tripped={})",
                last.requests(), last.failures(), tripped.get());
    }

    private void offer(Signal signal) {
        offered.incrementAndGet();
        if (!queue.offer(signal)) {
            offered.decrementAndGet();
            log.warn("Statistics queue full, dropping {} signal", signal);
        }
    }

    private void consume() {
        while (true) {
            Signal signal;
            try {
                signal = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            Counts current = counts.get();
            switch (signal) {
                case SUCCESS -> counts.set(current.plus(false));
                case FAILURE -> counts.set(current.plus(true));
                case RESET -> {
                    log.debug("Resetting statistics window (requests={}, failures={})",
                            current.requests(), current.failures());
                    counts.set(Counts.empty(clock.instant()));
                }
                case STOP -> {
                    return;
                }
            }
            processed.incrementAndGet();
        }
    }

    /**
     * Counters of one window. Replaced as a whole by the consumer thread.
     */
    record Counts(long requests, long failures, Instant windowStart) {

        static Counts empty(Instant start) {
            return new Counts(0, 0, start);
        }

        Counts plus(boolean failed) {
            return new Counts(requests + 1, failed ? failures + 1 : failures, windowStart);
        }

        double failureRate() {
            return requests == 0 ? 0.0 : (double) failures / requests;
        }
    }
}
