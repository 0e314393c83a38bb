package com.focusflow.backend.modules.mode.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.focusflow.backend.modules.mode.domain.ActivityMode;
import com.focusflow.backend.modules.mode.domain.BlockedMessage;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.domain.TransitionReason;

import org.springframework.stereotype.Component;

@Component
public class SessionSummaryAssembler {

    public static final String EVENT_SESSION_SUMMARY = "focus_session_summary";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SessionSummaryAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the summary of a closed session. Actual duration is clamped to at least one minute.
     */
    public SessionSummary assemble(
            FocusSession session,
            List<BlockedMessage> blockedMessages,
            List<ModeTransition> transitions
    ) {
        SessionSummary.SessionDetails details = new SessionSummary.SessionDetails(
                session.getId(),
                session.getUserId(),
                session.getModeLabel(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getPlannedDurationMinutes(),
                session.getExpectedEnd()
        );
        SessionSummary.Metrics metrics = new SessionSummary.Metrics(
                session.actualDurationMinutes(session.getEndedAt()),
                session.getInterruptionCount(),
                blockedMessages.size()
        );
        List<SessionSummary.BlockedMessageEntry> blocked = blockedMessages.stream()
                .map(message -> new SessionSummary.BlockedMessageEntry(
                        message.getId(),
                        message.getChannelId(),
                        message.getMessagePreview(),
                        message.getPayload(),
                        message.getCreatedAt()
                ))
                .toList();
        List<SessionSummary.TransitionEntry> history = transitions.stream()
                .map(transition -> new SessionSummary.TransitionEntry(
                        transition.getId(),
                        codeOf(transition.getPreviousMode()),
                        codeOf(transition.getNextMode()),
                        transition.getReason(),
                        transition.getCreatedAt()
                ))
                .toList();
        return new SessionSummary(details, metrics, blocked, history);
    }

    public Map<String, Object> toAuditMetadata(SessionSummary summary, TransitionReason reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", summary.session().id());
        metadata.put("userId", summary.session().userId());
        metadata.put("reason", reason.code());
        metadata.put("summary", objectMapper.convertValue(summary, MAP_TYPE));
        return metadata;
    }

    private static String codeOf(ActivityMode mode) {
        return mode == null ? null : mode.code();
    }
}
