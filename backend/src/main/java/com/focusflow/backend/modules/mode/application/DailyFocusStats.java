package com.focusflow.backend.modules.mode.application;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.focusflow.backend.modules.mode.domain.FocusSession;

/**
 * Totals over the sessions a user closed within one recap window.
 */
public record DailyFocusStats(
        String userId,
        int sessionCount,
        long focusedMinutes,
        int interruptions,
        long blockedMessages,
        OffsetDateTime windowStart,
        OffsetDateTime windowEnd
) {

    public static DailyFocusStats of(
            String userId,
            List<FocusSession> closedSessions,
            long blockedMessages,
            OffsetDateTime windowStart,
            OffsetDateTime windowEnd
    ) {
        long minutes = closedSessions.stream()
                .mapToLong(session -> session.actualDurationMinutes(windowEnd))
                .sum();
        int interruptions = closedSessions.stream()
                .mapToInt(FocusSession::getInterruptionCount)
                .sum();
        return new DailyFocusStats(
                userId,
                closedSessions.size(),
                minutes,
                interruptions,
                blockedMessages,
                windowStart,
                windowEnd
        );
    }

    public boolean hasActivity() {
        return sessionCount > 0 || blockedMessages > 0;
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionCount", sessionCount);
        metadata.put("durationMinutes", focusedMinutes);
        metadata.put("interruptions", interruptions);
        metadata.put("blockedMessages", blockedMessages);
        metadata.put("windowStart", windowStart.toString());
        metadata.put("windowEnd", windowEnd.toString());
        return metadata;
    }
}
