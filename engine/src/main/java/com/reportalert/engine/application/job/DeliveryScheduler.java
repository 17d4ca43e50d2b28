package com.reportalert.engine.application.job;

import com.reportalert.engine.application.config.EngineProperties;
import com.reportalert.engine.domain.artifact.ArtifactRepository;
import com.reportalert.engine.domain.binding.JobBindingRepository;
import com.reportalert.engine.domain.binding.JobBindingService;
import com.reportalert.engine.domain.delivery.DeliveryOutcome;
import com.reportalert.engine.domain.delivery.DeliveryPipeline;
import com.reportalert.engine.domain.schedule.DueSetResolver;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep that finds due reports and drives each through the delivery pipeline.
 *
 * <p>A report is due when its active cron binding has reached {@code nextRunAt}, or when
 * interval reconciliation says it should have been sent by now. Both sources are merged
 * per report, binding first. Ticks never overlap: a tick that finds the previous one
 * still running returns immediately.
 *
 * <p>Started before the embedded web server and stopped after it, so the timer exists
 * before traffic is accepted and in-flight deliveries get the configured grace period
 * on shutdown.
 */
@Slf4j
@Component
public class DeliveryScheduler implements SmartLifecycle {

    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    enum Source {
        BINDING,
        RECONCILIATION
    }

    private final JobBindingRepository bindingRepository;
    private final ArtifactRepository artifactRepository;
    private final DueSetResolver dueSetResolver;
    private final DeliveryPipeline deliveryPipeline;
    private final JobBindingService jobBindingService;
    private final EngineProperties.Scheduler settings;
    private final Clock clock;
    private final Counter schedulerTicksCounter;
    private final Counter schedulerTicksSkippedCounter;

    private final AtomicBoolean tickInProgress = new AtomicBoolean();
    private final Object lifecycleMonitor = new Object();

    private volatile boolean running;
    private ThreadPoolTaskScheduler timer;
    private volatile ThreadPoolTaskExecutor workers;
    private ScheduledFuture<?> tickHandle;

    public DeliveryScheduler(JobBindingRepository bindingRepository,
                             ArtifactRepository artifactRepository,
                             DueSetResolver dueSetResolver,
                             DeliveryPipeline deliveryPipeline,
                             JobBindingService jobBindingService,
                             EngineProperties properties,
                             Clock clock,
                             Counter schedulerTicksCounter,
                             Counter schedulerTicksSkippedCounter) {
        this.bindingRepository = bindingRepository;
        this.artifactRepository = artifactRepository;
        this.dueSetResolver = dueSetResolver;
        this.deliveryPipeline = deliveryPipeline;
        this.jobBindingService = jobBindingService;
        this.settings = properties.scheduler();
        this.clock = clock;
        this.schedulerTicksCounter = schedulerTicksCounter;
        this.schedulerTicksSkippedCounter = schedulerTicksSkippedCounter;
    }

    /**
     * Starts the worker pool and the tick timer; the first tick runs immediately.
     * Calling it on a running scheduler only logs a warning.
     */
    public void init() {
        synchronized (lifecycleMonitor) {
            if (running) {
                log.warn("Delivery scheduler already running, ignoring init");
                return;
            }
            deliveryPipeline.clearShutdownSignal();
            workers = newWorkerPool();
            timer = newTimer();
            tickHandle = timer.scheduleWithFixedDelay(this::tickFromTimer, settings.tickInterval());
            running = true;
            log.info("Delivery scheduler started: tick every {}, {} worker(s)",
                    settings.tickInterval(), settings.workerPoolSize());
        }
    }

    /**
     * Stops the timer, tells in-flight deliveries to stop at their next checkpoint and
     * waits up to the grace period for them before forcing the workers down.
     */
    public void shutdown() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            log.info("Shutting down delivery scheduler");
            tickHandle.cancel(false);
            deliveryPipeline.signalShutdown();
            awaitWorkers(workers, settings.shutdownGracePeriod());
            timer.shutdown();
            workers = null;
            timer = null;
            tickHandle = null;
            log.info("Delivery scheduler stopped");
        }
    }

    /**
     * Runs one sweep now. Without a running worker pool the due reports are delivered
     * sequentially on the calling thread.
     */
    public TickReport tick() {
        var startedAt = clock.instant();
        if (!tickInProgress.compareAndSet(false, true)) {
            schedulerTicksSkippedCounter.increment();
            log.info("Previous tick still running, skipping tick");
            return TickReport.overlapped(startedAt);
        }
        try {
            schedulerTicksCounter.increment();
            return sweep(startedAt);
        } finally {
            tickInProgress.set(false);
        }
    }

    @Override
    public void start() {
        init();
    }

    @Override
    public void stop() {
        shutdown();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.enabled();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    private void tickFromTimer() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private TickReport sweep(Instant now) {
        var dueBindings = bindingRepository.findDue(now);
        var reconciled = dueSetResolver.findDue(artifactRepository.findScheduled(), now);

        Map<String, Source> dueReports = new LinkedHashMap<>();
        dueBindings.forEach(binding -> dueReports.putIfAbsent(binding.artifactId(), Source.BINDING));
        reconciled.forEach(artifact -> dueReports.putIfAbsent(artifact.id(), Source.RECONCILIATION));
        var reconciledOnly = (int) dueReports.values().stream()
                .filter(source -> source == Source.RECONCILIATION)
                .count();

        if (dueReports.isEmpty()) {
            log.debug("Tick at {}: nothing due", now);
            return TickReport.of(now, 0, 0, List.of());
        }
        log.info("Tick at {}: {} report(s) due by binding, {} by reconciliation",
                now, dueBindings.size(), reconciledOnly);

        var outcomes = dispatch(new ArrayList<>(dueReports.keySet()), now);
        var report = TickReport.of(now, dueBindings.size(), reconciledOnly, outcomes);
        log.info("Tick at {} complete: {} delivered, {} failed, {} skipped",
                now, report.delivered(), report.failed(), report.skipped());
        return report;
    }

    private List<DeliveryOutcome> dispatch(List<String> reportIds, Instant now) {
        var pool = workers;
        if (pool == null) {
            return reportIds.stream().map(id -> process(id, now)).toList();
        }

        var futures = new ArrayList<Future<DeliveryOutcome>>(reportIds.size());
        for (var reportId : reportIds) {
            try {
                futures.add(pool.submit(() -> process(reportId, now)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        var outcomes = new ArrayList<DeliveryOutcome>(reportIds.size());
        for (int i = 0; i < reportIds.size(); i++) {
            outcomes.add(await(reportIds.get(i), futures.get(i)));
        }
        return outcomes;
    }

    private DeliveryOutcome await(String reportId, Future<DeliveryOutcome> future) {
        if (future == null) {
            return DeliveryOutcome.skipped(reportId, "engine shutting down");
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            return DeliveryOutcome.skipped(reportId, "engine shutting down");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryOutcome.skipped(reportId, "engine shutting down");
        } catch (ExecutionException e) {
            log.error("Delivery of report {} failed unexpectedly", reportId, e.getCause());
            return DeliveryOutcome.failed(reportId, null, String.valueOf(e.getCause().getMessage()));
        }
    }

    private DeliveryOutcome process(String reportId, Instant tickStartedAt) {
        DeliveryOutcome outcome;
        try {
            outcome = deliveryPipeline.deliverOnce(reportId);
        } catch (RuntimeException e) {
            log.error("Delivery of report {} failed unexpectedly", reportId, e);
            outcome = DeliveryOutcome.failed(reportId, null, e.getMessage());
        }
        if (!deliveryPipeline.isShuttingDown()) {
            try {
                jobBindingService.advanceAfterRun(reportId, tickStartedAt, outcome);
            } catch (RuntimeException e) {
                log.error("Failed to advance job for report {}", reportId, e);
            }
        }
        return outcome;
    }

    private ThreadPoolTaskExecutor newWorkerPool() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.workerPoolSize());
        executor.setMaxPoolSize(settings.workerPoolSize());
        executor.setThreadNamePrefix("delivery-worker-");
        executor.initialize();
        return executor;
    }

    private ThreadPoolTaskScheduler newTimer() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("delivery-tick-");
        scheduler.initialize();
        return scheduler;
    }

    private static void awaitWorkers(ThreadPoolTaskExecutor workers, Duration gracePeriod) {
        var pool = workers.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (!pool.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Deliveries still running after {}, forcing shutdown", gracePeriod);
                pool.shutdownNow().forEach(task -> {
                    if (task instanceof Future<?> pending) {
                        pending.cancel(true);
                    }
                });
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
