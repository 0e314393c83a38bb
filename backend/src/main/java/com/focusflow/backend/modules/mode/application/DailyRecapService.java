package com.focusflow.backend.modules.mode.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.notification.application.NotificationGateway;
import com.focusflow.backend.modules.notification.application.NotificationMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DailyRecapService {

    private static final Logger log = LoggerFactory.getLogger(DailyRecapService.class);

    public static final String EVENT_DAILY_RECAP = "daily_focus_recap";
    public static final String KIND_DAILY_RECAP = "DAILY_FOCUS_RECAP";

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);
    private static final DateTimeFormatter DATE_KEY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final ModeStateStore store;
    private final NotificationGateway notificationGateway;

    public DailyRecapService(ModeStateStore store, NotificationGateway notificationGateway) {
        this.store = store;
        this.notificationGateway = notificationGateway;
    }

    public DailyFocusStats computeStats(String userId, OffsetDateTime windowStart, OffsetDateTime windowEnd) {
        List<FocusSession> closed = store.findSessionsEndedBetween(userId, windowStart, windowEnd);
        List<Long> sessionIds = closed.stream()
                .map(FocusSession::getId)
                .toList();
        long blocked = store.countBlockedMessages(sessionIds);
        return DailyFocusStats.of(userId, closed, blocked, windowStart, windowEnd);
    }

    /**
     * Sends the recap for {@code day} and records it in the audit log. Returns {@code false} when the
     * notification was not delivered; nothing is recorded in that case. A recap already sent for the
     * same day counts as delivered and is not recorded again.
     */
    public boolean sendRecap(DailyFocusStats stats, LocalDate day) {
        String body = String.join("\n",
                "Daily Focus Recap (" + day.format(LABEL_FORMAT) + ")",
                "Sessions completed: " + stats.sessionCount(),
                "Focused minutes: " + stats.focusedMinutes(),
                "Interruptions: " + stats.interruptions(),
                "Blocked messages: " + stats.blockedMessages()
        );
        String dedupeKey = KIND_DAILY_RECAP + ":" + stats.userId() + ":" + day.format(DATE_KEY_FORMAT);
        if (notificationGateway.isDelivered(stats.userId(), dedupeKey)) {
            log.debug("Daily recap for user {} ({}) already sent", stats.userId(), day);
            return true;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("day", day.toString());
        metadata.putAll(stats.toMetadata());

        boolean delivered = notificationGateway.notify(new NotificationMessage(
                stats.userId(),
                KIND_DAILY_RECAP,
                "Daily Focus Recap",
                body,
                dedupeKey,
                metadata
        ));
        if (!delivered) {
            log.warn("Daily recap for user {} ({}) was not delivered", stats.userId(), day);
            return false;
        }

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("userId", stats.userId());
        audit.put("day", day.toString());
        audit.put("stats", stats.toMetadata());
        store.recordAuditEvent(EVENT_DAILY_RECAP, audit);
        log.info("Daily recap sent to user {} ({} sessions, {} min)", stats.userId(), stats.sessionCount(), stats.focusedMinutes());
        return true;
    }
}
