package com.dexrouter.backend.service.queue;

import com.dexrouter.backend.config.RouterProperties;
import com.dexrouter.backend.service.MetricsService;
import io.github.resilience4j.core.IntervalFunction;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admission queue for order executions.
 * <p>
 * A dispatcher thread takes jobs in FIFO order, waits for one of {@code concurrency} execution slots and
 * for room in the rolling admission window, then hands the job to the worker pool. A failed attempt that
 * can be retried is parked for an exponential backoff (base delay doubled per retry, counted from the
 * failure) and then goes back to the tail of the same queue, so retries compete for slots and count
 * against the admission window like new orders. A job keeps its identity, the order id, across retries.
 */
@Service
@Slf4j
public class OrderQueueService {

    private static final long POLL_MILLIS = 250;

    private final RouterProperties.Queue settings;
    private final OrderJobProcessor processor;
    private final Executor workerExecutor;
    private final MetricsService metricsService;
    private final IntervalFunction backoff;
    private final AdmissionRateLimiter admissionLimiter;
    private final Semaphore slots;

    private final LinkedBlockingQueue<OrderJob> waiting = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, OrderJob> liveJobs = new ConcurrentHashMap<>();
    private final ArrayDeque<OrderJob> completedHistory = new ArrayDeque<>();
    private final ArrayDeque<OrderJob> failedHistory = new ArrayDeque<>();
    private final AtomicInteger active = new AtomicInteger();
    // Taken off the queue by the dispatcher, still waiting for admission
    private final AtomicInteger admitting = new AtomicInteger();
    private final AtomicInteger delayed = new AtomicInteger();
    private final AtomicLong completedTotal = new AtomicLong();
    private final AtomicLong failedTotal = new AtomicLong();

    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "order-retry");
        thread.setDaemon(true);
        return thread;
    });

    private volatile boolean running;
    private Thread dispatcher;

    @Autowired
    public OrderQueueService(RouterProperties properties,
                             OrderJobProcessor processor,
                             @Qualifier("orderExecutor") Executor workerExecutor,
                             MetricsService metricsService) {
        this(properties.getQueue(), processor, workerExecutor, metricsService);
    }

    public OrderQueueService(RouterProperties.Queue settings,
                             OrderJobProcessor processor,
                             Executor workerExecutor,
                             MetricsService metricsService) {
        this.settings = settings;
        this.processor = processor;
        this.workerExecutor = workerExecutor;
        this.metricsService = metricsService;
        this.backoff = IntervalFunction.ofExponentialBackoff(settings.getRetryDelayMs(), 2.0);
        this.admissionLimiter = new AdmissionRateLimiter(settings.getMaxOrdersPerMinute(), settings.getRateWindowMs());
        this.slots = new Semaphore(settings.getConcurrency(), true);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        metricsService.registerQueueGauge("order_queue_waiting", this::waitingCount);
        metricsService.registerQueueGauge("order_queue_active", active::get);
        dispatcher = new Thread(this::dispatchLoop, "order-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Order queue started concurrency={} maxOrdersPerWindow={} windowMs={} maxRetries={}",
                settings.getConcurrency(), settings.getMaxOrdersPerMinute(), settings.getRateWindowMs(),
                settings.getMaxRetries());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        retryScheduler.shutdownNow();
        if (dispatcher != null) {
            dispatcher.interrupt();
            try {
                dispatcher.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Order queue stopped waiting={} delayed={} active={}", waitingCount(), delayed.get(), active.get());
    }

    /**
     * Queues the order for execution. An order that already has a live job is not queued twice.
     */
    public OrderJob enqueue(String orderId) {
        return enqueue(orderId, 0);
    }

    /**
     * Queues an order that already used {@code priorAttempts} attempts, for example in a previous run.
     */
    public OrderJob enqueue(String orderId, int priorAttempts) {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId is required");
        }
        OrderJob job = new OrderJob(orderId, Math.max(0, priorAttempts));
        OrderJob existing = liveJobs.putIfAbsent(orderId, job);
        if (existing != null) {
            log.debug("Order already queued orderId={} state={}", orderId, existing.getState());
            return existing;
        }
        waiting.offer(job);
        log.debug("Order queued orderId={} waiting={}", orderId, waiting.size());
        return job;
    }

    public QueueMetrics metrics() {
        return new QueueMetrics(waitingCount(), delayed.get(), active.get(), completedTotal.get(), failedTotal.get());
    }

    private int waitingCount() {
        return waiting.size() + admitting.get();
    }

    public Optional<OrderJob> liveJob(String orderId) {
        return Optional.ofNullable(liveJobs.get(orderId));
    }

    /**
     * Most recent finished jobs, newest first, up to the retention limit for that state.
     */
    public List<OrderJob> recentJobs(JobState state) {
        ArrayDeque<OrderJob> history = state == JobState.FAILED ? failedHistory : completedHistory;
        synchronized (history) {
            List<OrderJob> copy = new ArrayList<>(history);
            Collections.reverse(copy);
            return copy;
        }
    }

    private void dispatchLoop() {
        while (running) {
            OrderJob job;
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                job = waiting.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (job == null) {
                    slots.release();
                    continue;
                }
            } catch (InterruptedException e) {
                slots.release();
                Thread.currentThread().interrupt();
                break;
            }
            admitting.incrementAndGet();
            try {
                admissionLimiter.acquire();
            } catch (InterruptedException e) {
                admitting.decrementAndGet();
                slots.release();
                Thread.currentThread().interrupt();
                break;
            }
            admitting.decrementAndGet();
            launch(job);
        }
        log.debug("Order dispatcher exiting");
    }

    private void launch(OrderJob job) {
        job.markActive();
        active.incrementAndGet();
        try {
            workerExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException ex) {
            log.error("Worker pool rejected order orderId={}", job.getOrderId(), ex);
            active.decrementAndGet();
            slots.release();
            job.markWaiting();
            waiting.offer(job);
        }
    }

    private void runJob(OrderJob job) {
        try {
            settle(job, attempt(job));
        } finally {
            active.decrementAndGet();
            slots.release();
        }
    }

    private AttemptResult attempt(OrderJob job) {
        try {
            return processor.process(job.getOrderId());
        } catch (RuntimeException ex) {
            String error = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Order attempt crashed orderId={} attempt={}", job.getOrderId(), job.getAttempts(), ex);
            if (job.getAttempts() < settings.getMaxRetries()) {
                return AttemptResult.retry(job.getAttempts(), error);
            }
            abandon(job, error);
            return AttemptResult.failed(job.getAttempts(), error);
        }
    }

    private void abandon(OrderJob job, String error) {
        try {
            processor.abandon(job.getOrderId(), error, job.getAttempts());
        } catch (RuntimeException ex) {
            log.error("Could not mark crashed order failed orderId={}, left for startup recovery",
                    job.getOrderId(), ex);
        }
    }

    private void settle(OrderJob job, AttemptResult result) {
        switch (result.outcome()) {
            case CONFIRMED, SKIPPED -> complete(job);
            case FAILED -> fail(job, result.error());
            case RETRY -> scheduleRetry(job, result);
        }
    }

    private void scheduleRetry(OrderJob job, AttemptResult result) {
        if (!running) {
            log.warn("Queue stopping, retry not scheduled orderId={}", job.getOrderId());
            liveJobs.remove(job.getOrderId(), job);
            return;
        }
        long delayMillis = backoff.apply(Math.max(1, result.retryCount()));
        job.markDelayed(Instant.now().plusMillis(delayMillis), result.error());
        delayed.incrementAndGet();
        try {
            retryScheduler.schedule(() -> readmit(job), delayMillis, TimeUnit.MILLISECONDS);
            log.info("Order retry scheduled orderId={} retryCount={} delayMs={}",
                    job.getOrderId(), result.retryCount(), delayMillis);
        } catch (RejectedExecutionException ex) {
            delayed.decrementAndGet();
            liveJobs.remove(job.getOrderId(), job);
            log.warn("Retry scheduler closed, retry dropped orderId={}", job.getOrderId());
        }
    }

    private void readmit(OrderJob job) {
        delayed.decrementAndGet();
        job.markWaiting();
        waiting.offer(job);
    }

    private void complete(OrderJob job) {
        liveJobs.remove(job.getOrderId(), job);
        job.markCompleted();
        completedTotal.incrementAndGet();
        retain(completedHistory, job, settings.getRetainCompleted());
    }

    private void fail(OrderJob job, String error) {
        liveJobs.remove(job.getOrderId(), job);
        job.markFailed(error);
        failedTotal.incrementAndGet();
        retain(failedHistory, job, settings.getRetainFailed());
    }

    private void retain(ArrayDeque<OrderJob> history, OrderJob job, int limit) {
        synchronized (history) {
            history.addLast(job);
            while (history.size() > limit) {
                history.pollFirst();
            }
        }
    }
}
