package com.focusflow.backend.modules.meeting.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.global.scheduling.AbstractScheduledJob;
import com.focusflow.backend.global.scheduling.JobRunReport;
import com.focusflow.backend.modules.audit.application.AuditEventService;
import com.focusflow.backend.modules.meeting.domain.MeetingNote;
import com.focusflow.backend.modules.meeting.infrastructure.persistence.MeetingNoteRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.PeriodicTrigger;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Summarizes pending meeting notes, one summary per user per run. The summarizer is called outside
 * any transaction; the audit record and the summarized flags are then written together, so a failed
 * call leaves the notes pending for the next run.
 */
@Component
public class MeetingNoteSummaryJob extends AbstractScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(MeetingNoteSummaryJob.class);

    public static final String NAME = "meeting-note-summary";

    private final MeetingNoteRepository meetingNoteRepository;
    private final SummarizationGateway summarizationGateway;
    private final AuditEventService auditEventService;
    private final TransactionTemplate transactionTemplate;
    private final FocusFlowProperties.MeetingSummary settings;
    private final Clock clock;

    public MeetingNoteSummaryJob(
            MeetingNoteRepository meetingNoteRepository,
            SummarizationGateway summarizationGateway,
            AuditEventService auditEventService,
            PlatformTransactionManager transactionManager,
            FocusFlowProperties properties,
            TaskScheduler taskScheduler,
            Clock clock
    ) {
        super(taskScheduler, clock);
        this.meetingNoteRepository = meetingNoteRepository;
        this.summarizationGateway = summarizationGateway;
        this.auditEventService = auditEventService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.settings = properties.jobs().meetingSummary();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Trigger trigger() {
        return new PeriodicTrigger(settings.interval());
    }

    @Override
    protected String describeTrigger() {
        return "interval " + settings.interval() + ", window " + settings.window();
    }

    @Override
    protected JobRunReport execute() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<MeetingNote> pending = meetingNoteRepository.findPendingSince(
                now.minus(settings.window()),
                PageRequest.of(0, settings.batchLimit())
        );
        if (pending.isEmpty()) {
            log.debug("No pending meeting notes");
            return JobRunReport.empty(NAME);
        }

        Map<String, List<MeetingNote>> byUser = pending.stream()
                .filter(note -> StringUtils.hasText(note.getUserId()))
                .collect(Collectors.groupingBy(MeetingNote::getUserId, LinkedHashMap::new, Collectors.toList()));
        int unattributed = pending.size() - byUser.values().stream().mapToInt(List::size).sum();
        if (unattributed > 0) {
            log.debug("Dropped {} meeting notes without a user", unattributed);
        }

        JobRunReport.Tally tally = JobRunReport.tally(NAME);
        byUser.forEach((userId, notes) -> {
            try {
                summarizeUser(userId, notes);
                tally.success();
            } catch (RuntimeException ex) {
                tally.failure();
                log.warn("[ALERT][Batch][{}] user={} notes={} detail={}",
                        NAME, userId, notes.size(), ex.getMessage(), ex);
            }
        });

        JobRunReport report = tally.report();
        log.info("Meeting summary run finished: notes={} users={} succeeded={} failed={}",
                pending.size(), report.total(), report.succeeded(), report.failed());
        return report;
    }

    private void summarizeUser(String userId, List<MeetingNote> notes) {
        long windowMinutes = settings.window().toMinutes();
        String transcript = notes.stream()
                .map(note -> "- " + note.getBody())
                .collect(Collectors.joining("\n"))
                .trim();
        String summary = summarizationGateway.summarize(
                new SummarizationRequest(userId, transcript, notes.size(), windowMinutes)
        );

        List<Long> noteIds = notes.stream()
                .map(MeetingNote::getId)
                .toList();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", userId);
        metadata.put("summary", summary);
        metadata.put("noteIds", noteIds);
        metadata.put("noteCount", notes.size());
        metadata.put("windowMinutes", windowMinutes);

        transactionTemplate.executeWithoutResult(status -> {
            auditEventService.record(AuditEventService.EVENT_MEETING_SUMMARY, metadata);
            meetingNoteRepository.markSummarized(noteIds, OffsetDateTime.now(clock));
        });
        log.info("Meeting summary generated for user {} from {} notes", userId, notes.size());
    }
}
