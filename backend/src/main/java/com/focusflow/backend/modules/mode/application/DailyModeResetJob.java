package com.focusflow.backend.modules.mode.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import com.focusflow.backend.global.common.time.TimeWindows;
import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.global.config.FocusFlowProperties.RecapPolicy;
import com.focusflow.backend.global.scheduling.AbstractScheduledJob;
import com.focusflow.backend.global.scheduling.JobRunReport;
import com.focusflow.backend.modules.mode.domain.UserModeState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Once a day: every user back to idle, then one recap per affected user covering the day that just
 * ended. Resets and recaps are both per-user and isolated from each other's failures.
 */
@Component
public class DailyModeResetJob extends AbstractScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(DailyModeResetJob.class);

    public static final String NAME = "daily-mode-reset";

    private final ModeStateStore store;
    private final SessionLifecycleService lifecycleService;
    private final DailyRecapService recapService;
    private final FocusFlowProperties.DailyReset settings;
    private final Clock clock;

    private volatile OffsetDateTime lastWindowEnd;

    public DailyModeResetJob(
            ModeStateStore store,
            SessionLifecycleService lifecycleService,
            DailyRecapService recapService,
            FocusFlowProperties properties,
            TaskScheduler taskScheduler,
            Clock clock
    ) {
        super(taskScheduler, clock);
        this.store = store;
        this.lifecycleService = lifecycleService;
        this.recapService = recapService;
        this.settings = properties.jobs().dailyReset();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Trigger trigger() {
        return new CronTrigger(settings.cronExpression(), settings.zone());
    }

    @Override
    protected String describeTrigger() {
        return "daily at " + settings.time() + " " + settings.zone();
    }

    @Override
    protected JobRunReport execute() {
        OffsetDateTime runStartedAt = OffsetDateTime.now(clock);
        LocalDate day = TimeWindows.reportingDay(runStartedAt, settings.zone());

        List<UserModeState> snapshot = store.findAllStates();
        List<String> affected = new ArrayList<>();
        int resetFailures = 0;
        for (UserModeState state : snapshot) {
            try {
                lifecycleService.resetForNewDay(state.getUserId());
                affected.add(state.getUserId());
            } catch (RuntimeException ex) {
                resetFailures++;
                log.warn("[ALERT][Batch][{}] reset user={} detail={}", NAME, state.getUserId(), ex.getMessage(), ex);
            }
        }
        log.info("Daily reset moved {} of {} users to idle", affected.size(), snapshot.size());

        // Sessions closed by the loop above end after runStartedAt and belong to the day being recapped.
        OffsetDateTime windowEnd = OffsetDateTime.now(clock);
        OffsetDateTime windowStart = recapWindowStart(runStartedAt);
        lastWindowEnd = windowEnd;

        JobRunReport.Tally tally = JobRunReport.tally(NAME);
        for (int i = 0; i < resetFailures; i++) {
            tally.failure();
        }
        for (String userId : affected) {
            try {
                DailyFocusStats stats = recapService.computeStats(userId, windowStart, windowEnd);
                if (settings.recapPolicy() == RecapPolicy.ACTIVE_ONLY && !stats.hasActivity()) {
                    log.debug("No activity for user {} on {}; recap skipped", userId, day);
                    tally.success();
                    continue;
                }
                if (recapService.sendRecap(stats, day)) {
                    tally.success();
                } else {
                    tally.failure();
                }
            } catch (RuntimeException ex) {
                tally.failure();
                log.warn("[ALERT][Batch][{}] recap user={} detail={}", NAME, userId, ex.getMessage(), ex);
            }
        }

        JobRunReport report = tally.report();
        log.info("Daily reset finished for {}: total={} succeeded={} failed={}",
                day, report.total(), report.succeeded(), report.failed());
        return report;
    }

    /**
     * Picks up where the previous run's window ended, so sessions closed by that run's reset are not
     * counted again. Falls back to one day back on the first run or when the previous window is stale.
     */
    private OffsetDateTime recapWindowStart(OffsetDateTime runStartedAt) {
        OffsetDateTime fallback = runStartedAt.minusDays(1);
        OffsetDateTime previous = lastWindowEnd;
        if (previous == null || previous.isBefore(fallback.minusDays(1)) || previous.isAfter(runStartedAt)) {
            return fallback;
        }
        // window bounds are inclusive; storage keeps microseconds
        return previous.plus(1, ChronoUnit.MICROS);
    }
}
