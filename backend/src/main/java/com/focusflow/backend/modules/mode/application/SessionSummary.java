package com.focusflow.backend.modules.mode.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * End-of-session report, computed once when a session closes and stored in the audit log.
 */
public record SessionSummary(
        SessionDetails session,
        Metrics metrics,
        List<BlockedMessageEntry> blockedMessages,
        List<TransitionEntry> transitions
) {

    public record SessionDetails(
            Long id,
            String userId,
            String mode,
            OffsetDateTime startedAt,
            OffsetDateTime endedAt,
            Integer plannedDurationMinutes,
            OffsetDateTime expectedEnd
    ) {
    }

    public record Metrics(
            long actualDurationMinutes,
            int interruptions,
            int blockedMessageCount
    ) {
    }

    public record BlockedMessageEntry(
            Long id,
            String channelId,
            String messagePreview,
            Map<String, Object> payload,
            OffsetDateTime createdAt
    ) {
    }

    public record TransitionEntry(
            Long id,
            String previousMode,
            String nextMode,
            String reason,
            OffsetDateTime createdAt
    ) {
    }
}
