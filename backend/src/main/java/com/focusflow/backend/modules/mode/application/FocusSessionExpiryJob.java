package com.focusflow.backend.modules.mode.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.global.scheduling.AbstractScheduledJob;
import com.focusflow.backend.global.scheduling.JobRunReport;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.TransitionReason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.PeriodicTrigger;
import org.springframework.stereotype.Component;

/**
 * Finalizes sessions whose planned end has passed. Each session is closed in its own unit of work;
 * one failure is logged and counted and the sweep moves on.
 */
@Component
public class FocusSessionExpiryJob extends AbstractScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(FocusSessionExpiryJob.class);

    public static final String NAME = "focus-session-expiry";

    private final ModeStateStore store;
    private final SessionLifecycleService lifecycleService;
    private final Duration interval;
    private final Clock clock;

    public FocusSessionExpiryJob(
            ModeStateStore store,
            SessionLifecycleService lifecycleService,
            FocusFlowProperties properties,
            TaskScheduler taskScheduler,
            Clock clock
    ) {
        super(taskScheduler, clock);
        this.store = store;
        this.lifecycleService = lifecycleService;
        this.interval = properties.jobs().expirySweep().interval();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Trigger trigger() {
        return new PeriodicTrigger(interval);
    }

    @Override
    protected String describeTrigger() {
        return "interval " + interval;
    }

    @Override
    protected JobRunReport execute() {
        List<FocusSession> expired = store.findExpiredOpenSessions(OffsetDateTime.now(clock));
        if (expired.isEmpty()) {
            log.debug("No expired focus sessions");
            return JobRunReport.empty(NAME);
        }

        JobRunReport.Tally tally = JobRunReport.tally(NAME);
        for (FocusSession session : expired) {
            try {
                lifecycleService.finalize(
                        session.getUserId(),
                        session.getId(),
                        FinalizeOptions.notifying(TransitionReason.SESSION_EXPIRED)
                );
                tally.success();
            } catch (RuntimeException ex) {
                tally.failure();
                log.warn("[ALERT][Batch][{}] user={} session={} detail={}",
                        NAME, session.getUserId(), session.getId(), ex.getMessage(), ex);
            }
        }

        JobRunReport report = tally.report();
        log.info("Expiry sweep finished: total={} succeeded={} failed={}",
                report.total(), report.succeeded(), report.failed());
        return report;
    }
}
