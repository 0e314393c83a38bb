package com.focusflow.backend.global.scheduling;

import java.time.Duration;

/**
 * Per-tick tally of a fan-out job: items seen, items that succeeded, items that failed.
 */
public record JobRunReport(
        String jobName,
        int total,
        int succeeded,
        int failed,
        boolean skipped,
        Duration elapsed
) {

    public static JobRunReport skipped(String jobName) {
        return new JobRunReport(jobName, 0, 0, 0, true, Duration.ZERO);
    }

    public static JobRunReport empty(String jobName) {
        return new JobRunReport(jobName, 0, 0, 0, false, Duration.ZERO);
    }

    public JobRunReport withElapsed(Duration duration) {
        return new JobRunReport(jobName, total, succeeded, failed, skipped, duration);
    }

    public static Tally tally(String jobName) {
        return new Tally(jobName);
    }

    public static final class Tally {

        private final String jobName;
        private int succeeded;
        private int failed;

        private Tally(String jobName) {
            this.jobName = jobName;
        }

        public void success() {
            succeeded++;
        }

        public void failure() {
            failed++;
        }

        public JobRunReport report() {
            return new JobRunReport(jobName, succeeded + failed, succeeded, failed, false, Duration.ZERO);
        }
    }
}
