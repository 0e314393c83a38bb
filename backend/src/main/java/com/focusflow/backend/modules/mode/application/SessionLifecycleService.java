package com.focusflow.backend.modules.mode.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.mode.domain.ActivityMode;
import com.focusflow.backend.modules.mode.domain.BlockedMessage;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.IncomingMessage;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.domain.TransitionReason;
import com.focusflow.backend.modules.mode.domain.UserModeState;
import com.focusflow.backend.modules.notification.application.NotificationGateway;
import com.focusflow.backend.modules.notification.application.NotificationMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * The mode state machine. Every mutating operation validates its input first and then runs as one
 * per-user unit of work on the {@link ModeStateStore}; notifications go out only after that unit
 * has committed.
 *
 * <p>Closing a session always produces exactly one {@link SessionSummary}, stored as a
 * {@code focus_session_summary} audit event in the same unit of work.</p>
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    public static final String KIND_SESSION_ENDED = "FOCUS_SESSION_ENDED";

    private final ModeStateStore store;
    private final FocusModeCatalogService catalogService;
    private final SessionSummaryAssembler summaryAssembler;
    private final NotificationGateway notificationGateway;
    private final FocusFlowProperties.Session settings;
    private final Clock clock;

    public SessionLifecycleService(
            ModeStateStore store,
            FocusModeCatalogService catalogService,
            SessionSummaryAssembler summaryAssembler,
            NotificationGateway notificationGateway,
            FocusFlowProperties properties,
            Clock clock
    ) {
        this.store = store;
        this.catalogService = catalogService;
        this.summaryAssembler = summaryAssembler;
        this.notificationGateway = notificationGateway;
        this.settings = properties.session();
        this.clock = clock;
    }

    public StartResult start(String userId, Integer requestedDurationMinutes) {
        String user = requireUserId(userId);
        if (requestedDurationMinutes != null && requestedDurationMinutes <= 0) {
            throw ProblemException.validation("mode.invalid_duration", "durationMinutes must be greater than 0");
        }
        int plannedMinutes = requestedDurationMinutes != null ? requestedDurationMinutes : resolveDefaultDuration();

        return store.inUserUnitOfWork(user, state -> {
            Optional<FocusSession> active = findActiveSession(state);
            if (state.isFocused() && active.isPresent()) {
                log.debug("Focus already active for user {} (session {})", user, active.get().getId());
                return new StartResult(ModeStateView.of(state, active.get()), SessionView.of(active.get()), true);
            }

            OffsetDateTime now = now();
            closeOpenSessions(user, now, TransitionReason.MANUAL_START);

            FocusSession session = store.saveSession(FocusSession.open(user, ActivityMode.FOCUS.code(), plannedMinutes, now));
            ActivityMode previous = state.getCurrentMode();
            state.enterFocus(session.getId(), now);
            store.saveState(state);
            store.appendTransition(new ModeTransition(user, previous, ActivityMode.FOCUS, TransitionReason.MANUAL_START, now));

            log.info("Focus started for user {} (session {}, {} min)", user, session.getId(), plannedMinutes);
            return new StartResult(ModeStateView.of(state, session), SessionView.of(session), false);
        });
    }

    public FinalizeResult stop(String userId) {
        return finalize(userId, null, FinalizeOptions.notifying(TransitionReason.MANUAL_STOP));
    }

    /**
     * Switches to a non-focus mode, closing any open session. {@code focus} is routed through
     * {@link #start(String, Integer)} so that focus is never entered without a session.
     */
    public SetModeResult setMode(String userId, String mode) {
        String user = requireUserId(userId);
        if (!StringUtils.hasText(mode)) {
            throw ProblemException.validation("mode.mode_required", "mode is required");
        }
        ActivityMode target = ActivityMode.fromCode(mode)
                .orElseThrow(() -> ProblemException.validation(
                        "mode.unsupported_mode",
                        "mode must be one of: " + ActivityMode.allowedCodes()
                ));

        if (target.ownsSession()) {
            StartResult started = start(user, null);
            return new SetModeResult(started.state(), started.alreadyActive(), List.of());
        }

        return store.inUserUnitOfWork(user, state -> {
            if (state.getCurrentMode() == target) {
                log.debug("User {} already in {}", user, target.code());
                return new SetModeResult(ModeStateView.of(state, null), true, List.of());
            }

            OffsetDateTime now = now();
            ActivityMode previous = state.getCurrentMode();
            state.switchTo(target, now);
            store.saveState(state);
            store.appendTransition(new ModeTransition(user, previous, target, TransitionReason.MANUAL_SET, now));
            List<Long> closed = closeOpenSessions(user, now, TransitionReason.MANUAL_SET);

            log.info("User {} switched {} -> {}", user, previous.code(), target.code());
            return new SetModeResult(ModeStateView.of(state, null), false, closed);
        });
    }

    public MessageHandlingResult handleIncomingMessage(String userId, IncomingMessage message) {
        String user = requireUserId(userId);
        if (message == null) {
            throw ProblemException.validation("mode.message_required", "message is required");
        }

        return store.inUserUnitOfWork(user, state -> {
            if (!state.isFocused()) {
                return MessageHandlingResult.passThrough(state.getCurrentMode());
            }

            OffsetDateTime now = now();
            FocusSession session = findActiveSession(state)
                    .orElseGet(() -> openRecoverySession(state, now));

            store.appendBlockedMessage(new BlockedMessage(
                    user,
                    session.getId(),
                    message.channelId(),
                    message.preview(settings.messagePreviewLength()),
                    message.toPayload(),
                    now
            ));
            session.recordInterruption();
            store.saveSession(session);
            store.appendTransition(new ModeTransition(
                    user,
                    ActivityMode.FOCUS,
                    ActivityMode.FOCUS,
                    TransitionReason.MESSAGE_BLOCKED,
                    now
            ));

            log.info("Message blocked for user {} (session {}, interruptions={})",
                    user, session.getId(), session.getInterruptionCount());
            return MessageHandlingResult.suppressed(session.getId(), session.getInterruptionCount());
        });
    }

    /**
     * Closes {@code sessionId}, or the user's active session when it is {@code null}. Returns a skipped
     * result when there is nothing open to close, which includes losing a race to another closer.
     */
    public FinalizeResult finalize(String userId, Long sessionId, FinalizeOptions options) {
        String user = requireUserId(userId);

        FinalizeResult result = store.inUserUnitOfWork(user, state -> {
            Long targetId = sessionId != null ? sessionId : state.getActiveSessionId();
            if (targetId == null) {
                log.debug("Nothing to finalize for user {}", user);
                return FinalizeResult.nothingToClose(view(state));
            }

            Optional<FocusSession> target = store.findSession(targetId)
                    .filter(session -> user.equals(session.getUserId()));
            OffsetDateTime now = now();
            if (target.isEmpty() || !target.get().close(now)) {
                log.debug("Session {} for user {} is unknown or already closed", targetId, user);
                return FinalizeResult.nothingToClose(view(state));
            }

            FocusSession session = store.saveSession(target.get());
            boolean holdsState = targetId.equals(state.getActiveSessionId())
                    || (state.isFocused() && !state.hasActiveSession());
            if (holdsState) {
                ActivityMode previous = state.getCurrentMode();
                state.switchTo(ActivityMode.BREAK, now);
                store.saveState(state);
                store.appendTransition(new ModeTransition(user, previous, ActivityMode.BREAK, options.reason(), now));
            }
            SessionSummary summary = persistSummary(session, options.reason());

            log.info("Session {} finalized for user {} ({}, {} min)",
                    session.getId(), user, options.reason().code(), summary.metrics().actualDurationMinutes());
            return new FinalizeResult(false, summary, view(state));
        });

        if (!result.skipped() && options.notifyUser()) {
            notifySessionEnded(user, result.summary());
        }
        return result;
    }

    /**
     * Forces the user to idle and closes any open session without a per-session notice.
     */
    public DailyResetOutcome resetForNewDay(String userId) {
        String user = requireUserId(userId);

        return store.inUserUnitOfWork(user, state -> {
            OffsetDateTime now = now();
            ActivityMode previous = state.getCurrentMode();
            if (previous != ActivityMode.IDLE || state.hasActiveSession()) {
                state.switchTo(ActivityMode.IDLE, now);
                store.saveState(state);
                store.appendTransition(new ModeTransition(user, previous, ActivityMode.IDLE, TransitionReason.DAILY_RESET, now));
            }
            List<Long> closed = closeOpenSessions(user, now, TransitionReason.DAILY_RESET);
            return new DailyResetOutcome(user, previous, closed);
        });
    }

    public ModeStateView getCurrentMode(String userId) {
        String user = requireUserId(userId);
        return store.findState(user)
                .map(this::view)
                .orElseGet(() -> ModeStateView.idle(user));
    }

    public ModeSummaryView getSummary(String userId) {
        String user = requireUserId(userId);
        OffsetDateTime since = now().minus(settings.blockedMessageLookback());

        Optional<UserModeState> state = store.findState(user);
        SessionView active = state.flatMap(this::findActiveSession)
                .map(SessionView::of)
                .orElse(null);
        List<SessionView> recent = store.findRecentSessions(user, settings.recentSessionLimit()).stream()
                .map(SessionView::of)
                .toList();
        long blocked = store.countBlockedMessagesSince(user, since);

        String currentMode = state.map(s -> s.getCurrentMode().code()).orElse(ActivityMode.IDLE.code());
        return new ModeSummaryView(user, currentMode, active, recent, blocked, since);
    }

    private List<Long> closeOpenSessions(String userId, OffsetDateTime now, TransitionReason reason) {
        List<Long> closed = new ArrayList<>();
        for (FocusSession session : store.findOpenSessions(userId)) {
            if (!session.close(now)) {
                continue;
            }
            store.saveSession(session);
            persistSummary(session, reason);
            closed.add(session.getId());
        }
        if (!closed.isEmpty()) {
            log.info("Closed open sessions {} for user {} ({})", closed, userId, reason.code());
        }
        return closed;
    }

    private SessionSummary persistSummary(FocusSession session, TransitionReason reason) {
        SessionSummary summary = summaryAssembler.assemble(
                session,
                store.findBlockedMessages(session.getId()),
                store.findTransitions(session.getUserId(), session.getStartedAt(), session.getEndedAt())
        );
        store.recordAuditEvent(
                SessionSummaryAssembler.EVENT_SESSION_SUMMARY,
                summaryAssembler.toAuditMetadata(summary, reason)
        );
        return summary;
    }

    private FocusSession openRecoverySession(UserModeState state, OffsetDateTime now) {
        FocusSession session = store.saveSession(FocusSession.open(
                state.getUserId(),
                ActivityMode.FOCUS.code(),
                resolveDefaultDuration(),
                now
        ));
        state.enterFocus(session.getId(), now);
        store.saveState(state);
        log.warn("User {} was in focus without an open session; opened session {}", state.getUserId(), session.getId());
        return session;
    }

    private void notifySessionEnded(String userId, SessionSummary summary) {
        SessionSummary.Metrics metrics = summary.metrics();
        String text = "Your focus session (" + metrics.actualDurationMinutes() + " mins) has ended. "
                + "Blocked messages: " + metrics.blockedMessageCount() + ".";
        NotificationMessage message = new NotificationMessage(
                userId,
                KIND_SESSION_ENDED,
                "Focus session ended",
                text,
                null,
                Map.of("sessionId", summary.session().id())
        );
        try {
            if (!notificationGateway.notify(message)) {
                log.warn("Session-ended notice not delivered to user {} (session {})", userId, summary.session().id());
            }
        } catch (RuntimeException ex) {
            log.warn("Session-ended notice failed for user {} (session {})", userId, summary.session().id(), ex);
        }
    }

    private Optional<FocusSession> findActiveSession(UserModeState state) {
        if (!state.hasActiveSession()) {
            return Optional.empty();
        }
        return store.findSession(state.getActiveSessionId())
                .filter(FocusSession::isOpen);
    }

    private ModeStateView view(UserModeState state) {
        return ModeStateView.of(state, findActiveSession(state).orElse(null));
    }

    private int resolveDefaultDuration() {
        return catalogService.defaultDurationMinutes()
                .orElse(settings.defaultDurationMinutes());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static String requireUserId(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ProblemException.validation("mode.user_id_required", "userId is required");
        }
        String trimmed = userId.trim();
        if (trimmed.length() > UserModeState.MAX_USER_ID_LENGTH) {
            throw ProblemException.validation("mode.invalid_user_id",
                    "userId must be at most " + UserModeState.MAX_USER_ID_LENGTH + " characters");
        }
        return trimmed;
    }

    public record StartResult(
            ModeStateView state,
            SessionView session,
            boolean alreadyActive
    ) {
    }

    public record SetModeResult(
            ModeStateView state,
            boolean unchanged,
            List<Long> closedSessionIds
    ) {
    }

    public record FinalizeResult(
            boolean skipped,
            SessionSummary summary,
            ModeStateView state
    ) {

        static FinalizeResult nothingToClose(ModeStateView state) {
            return new FinalizeResult(true, null, state);
        }
    }

    public record MessageHandlingResult(
            boolean blocked,
            boolean delivered,
            String reason,
            String mode,
            Long sessionId,
            Integer interruptionCount
    ) {

        static final String REASON_FOCUS = "User is in focus mode";

        static MessageHandlingResult passThrough(ActivityMode mode) {
            return new MessageHandlingResult(false, true, null, mode.code(), null, null);
        }

        static MessageHandlingResult suppressed(Long sessionId, int interruptionCount) {
            return new MessageHandlingResult(true, false, REASON_FOCUS, ActivityMode.FOCUS.code(), sessionId, interruptionCount);
        }
    }

    public record DailyResetOutcome(
            String userId,
            ActivityMode previousMode,
            List<Long> closedSessionIds
    ) {
    }

    public record ModeSummaryView(
            String userId,
            String currentMode,
            SessionView activeSession,
            List<SessionView> recentSessions,
            long blockedMessageCount,
            OffsetDateTime blockedMessagesSince
    ) {
    }
}
