package com.focusflow.backend.global.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

import com.focusflow.backend.global.web.LogContext;
import com.focusflow.backend.global.web.LogContext.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

/**
 * Timer-backed job: one {@link Trigger} on a shared {@link TaskScheduler}, and a single run slot so
 * ticks of the same job never overlap (a tick that finds the slot busy is skipped, not queued).
 */
public abstract class AbstractScheduledJob implements ScheduledJob {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ReentrantLock runSlot = new ReentrantLock();
    private ScheduledFuture<?> scheduled;

    protected AbstractScheduledJob(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    protected abstract Trigger trigger();

    protected abstract JobRunReport execute();

    @Override
    public synchronized void start() {
        if (scheduled != null) {
            log.warn("{} is already scheduled", name());
            return;
        }
        scheduled = taskScheduler.schedule(this::runScheduledTick, trigger());
        log.info("{} scheduled with {}", name(), describeTrigger());
    }

    @Override
    public synchronized void stop() {
        if (scheduled == null) {
            return;
        }
        // in-flight ticks finish; only future ticks are cancelled
        scheduled.cancel(false);
        scheduled = null;
        log.info("{} stopped", name());
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduled != null && !scheduled.isCancelled();
    }

    @Override
    public JobRunReport triggerNow() {
        log.info("{} triggered manually", name());
        return runTick();
    }

    protected String describeTrigger() {
        return trigger().toString();
    }

    private void runScheduledTick() {
        try {
            runTick();
        } catch (RuntimeException ex) {
            // keep the timer alive; the next tick retries
            log.error("{} tick failed", name(), ex);
        }
    }

    private JobRunReport runTick() {
        if (!runSlot.tryLock()) {
            log.info("{} tick skipped: previous run still in progress", name());
            return JobRunReport.skipped(name());
        }
        Instant startedAt = clock.instant();
        try (Scope ignored = LogContext.open(LogContext.JOB, name())) {
            JobRunReport report = execute();
            return report.withElapsed(Duration.between(startedAt, clock.instant()));
        } finally {
            runSlot.unlock();
        }
    }
}
