package com.focusflow.backend.modules.mode.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.focusflow.backend.modules.mode.domain.BlockedMessage;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.domain.UserModeState;

/**
 * Durable per-user mode state, sessions and the append-only logs around them.
 *
 * <p>{@link #inUserUnitOfWork} is the only way to mutate a user's state: the work runs atomically
 * while the user's state row is held exclusively, so two triggers racing on the same user serialize.
 * Every other method called from inside the work joins that unit; called outside it, each method is
 * its own short read or append. Different users never contend.</p>
 */
public interface ModeStateStore {

    /**
     * Runs {@code work} against the user's state row, creating an idle row first if the user has none.
     * Either everything the work wrote is kept, or nothing is.
     */
    <T> T inUserUnitOfWork(String userId, Function<UserModeState, T> work);

    Optional<UserModeState> findState(String userId);

    List<UserModeState> findAllStates();

    UserModeState saveState(UserModeState state);

    FocusSession saveSession(FocusSession session);

    Optional<FocusSession> findSession(Long sessionId);

    List<FocusSession> findOpenSessions(String userId);

    List<FocusSession> findRecentSessions(String userId, int limit);

    /**
     * Open sessions whose expected end (or start plus planned duration) is at or before {@code now}.
     */
    List<FocusSession> findExpiredOpenSessions(OffsetDateTime now);

    List<FocusSession> findSessionsEndedBetween(String userId, OffsetDateTime from, OffsetDateTime to);

    void appendTransition(ModeTransition transition);

    void appendBlockedMessage(BlockedMessage message);

    List<BlockedMessage> findBlockedMessages(Long sessionId);

    long countBlockedMessages(List<Long> sessionIds);

    long countBlockedMessagesSince(String userId, OffsetDateTime since);

    List<ModeTransition> findTransitions(String userId, OffsetDateTime from, OffsetDateTime to);

    void recordAuditEvent(String eventName, Map<String, Object> metadata);
}
