package com.focusflow.backend.global.scheduling;

/**
 * A recurring background job that can be started, stopped between ticks, and run on demand.
 */
public interface ScheduledJob {

    String name();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Runs one tick on the calling thread. Returns a skipped report if a tick is already in progress.
     */
    JobRunReport triggerNow();
}
