package com.thisthat.wagering.job;

import com.thisthat.wagering.config.WageringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic background job owned by the application context.
 *
 * start() runs the first cycle immediately, then one per interval. At most one cycle runs at a
 * time: a trigger arriving while a cycle is in flight is skipped, not queued. stop() cancels
 * future cycles and lets the current one finish. A failing cycle is logged and the next one
 * runs as scheduled.
 */
@Slf4j
public abstract class SingleFlightJob implements SmartLifecycle {

    private final String name;
    private final TaskScheduler scheduler;
    private final WageringProperties.Job settings;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> schedule;

    protected SingleFlightJob(String name, TaskScheduler scheduler, WageringProperties.Job settings) {
        this.name = name;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    /**
     * One cycle of work. Exceptions are logged by the caller.
     */
    protected abstract void runCycle();

    @Override
    public synchronized void start() {
        if (schedule != null) {
            log.info("Job already running: job={}", name);
            return;
        }
        Duration interval = settings.getInterval();
        schedule = scheduler.scheduleAtFixedRate(() -> runOnce("scheduled"), Instant.now(), interval);
        log.info("Job started: job={}, interval={}", name, interval);
    }

    @Override
    public synchronized void stop() {
        if (schedule == null) {
            return;
        }
        schedule.cancel(false);
        schedule = null;
        log.info("Job stopped: job={}", name);
    }

    @Override
    public boolean isRunning() {
        return schedule != null;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStartup();
    }

    /**
     * Run a cycle now unless one is in flight.
     *
     * @param trigger what caused the run, for the log
     * @return false if skipped because a cycle was already running
     */
    public boolean runOnce(String trigger) {
        if (!inFlight.compareAndSet(false, true)) {
            log.info("Job cycle skipped, previous cycle still running: job={}, trigger={}", name, trigger);
            return false;
        }
        long startedAt = System.currentTimeMillis();
        try {
            runCycle();
            log.debug("Job cycle finished: job={}, trigger={}, tookMs={}", name, trigger,
                    System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Job cycle failed: job={}, trigger={}, error={}", name, trigger, e.getMessage(), e);
        } finally {
            inFlight.set(false);
        }
        return true;
    }

    public boolean isCycleInFlight() {
        return inFlight.get();
    }

    public String getName() {
        return name;
    }
}
