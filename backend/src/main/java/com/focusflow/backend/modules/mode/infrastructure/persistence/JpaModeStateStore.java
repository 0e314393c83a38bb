package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.focusflow.backend.modules.audit.application.AuditEventService;
import com.focusflow.backend.modules.mode.application.ModeStateStore;
import com.focusflow.backend.modules.mode.domain.BlockedMessage;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.domain.UserModeState;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed store. A unit of work is one transaction that first upserts the user's state row
 * and then holds it with {@code SELECT ... FOR UPDATE}; session rows are only touched after that, so
 * locks are always taken state row first.
 */
@Component
public class JpaModeStateStore implements ModeStateStore {

    private final UserModeStateRepository userModeStateRepository;
    private final FocusSessionRepository focusSessionRepository;
    private final ModeTransitionRepository modeTransitionRepository;
    private final BlockedMessageRepository blockedMessageRepository;
    private final AuditEventService auditEventService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaModeStateStore(
            UserModeStateRepository userModeStateRepository,
            FocusSessionRepository focusSessionRepository,
            ModeTransitionRepository modeTransitionRepository,
            BlockedMessageRepository blockedMessageRepository,
            AuditEventService auditEventService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.userModeStateRepository = userModeStateRepository;
        this.focusSessionRepository = focusSessionRepository;
        this.modeTransitionRepository = modeTransitionRepository;
        this.blockedMessageRepository = blockedMessageRepository;
        this.auditEventService = auditEventService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public <T> T inUserUnitOfWork(String userId, Function<UserModeState, T> work) {
        return transactionTemplate.execute(status -> {
            userModeStateRepository.insertIfAbsent(userId, OffsetDateTime.now(clock));
            UserModeState state = userModeStateRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> new IllegalStateException("mode state row missing after upsert: " + userId));
            return work.apply(state);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserModeState> findState(String userId) {
        return userModeStateRepository.findById(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserModeState> findAllStates() {
        return userModeStateRepository.findAll();
    }

    @Override
    @Transactional
    public UserModeState saveState(UserModeState state) {
        return userModeStateRepository.save(state);
    }

    /**
     * Flushes immediately: a session closed earlier in the unit of work must reach the database before
     * a new open session is inserted, or the one-open-session-per-user index rejects the insert.
     */
    @Override
    @Transactional
    public FocusSession saveSession(FocusSession session) {
        return focusSessionRepository.saveAndFlush(session);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FocusSession> findSession(Long sessionId) {
        return focusSessionRepository.findById(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FocusSession> findOpenSessions(String userId) {
        return focusSessionRepository.findByUserIdAndEndedAtIsNullOrderByStartedAtAsc(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FocusSession> findRecentSessions(String userId, int limit) {
        return focusSessionRepository.findByUserIdOrderByStartedAtDesc(userId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<FocusSession> findExpiredOpenSessions(OffsetDateTime now) {
        return focusSessionRepository.findExpiredOpenSessions(now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FocusSession> findSessionsEndedBetween(String userId, OffsetDateTime from, OffsetDateTime to) {
        return focusSessionRepository.findByUserIdAndEndedAtBetweenOrderByEndedAtAsc(userId, from, to);
    }

    @Override
    @Transactional
    public void appendTransition(ModeTransition transition) {
        modeTransitionRepository.save(transition);
    }

    @Override
    @Transactional
    public void appendBlockedMessage(BlockedMessage message) {
        blockedMessageRepository.save(message);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BlockedMessage> findBlockedMessages(Long sessionId) {
        return blockedMessageRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countBlockedMessages(List<Long> sessionIds) {
        if (sessionIds.isEmpty()) {
            return 0L;
        }
        return blockedMessageRepository.countBySessionIdIn(sessionIds);
    }

    @Override
    @Transactional(readOnly = true)
    public long countBlockedMessagesSince(String userId, OffsetDateTime since) {
        return blockedMessageRepository.countByUserIdAndCreatedAtGreaterThanEqual(userId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModeTransition> findTransitions(String userId, OffsetDateTime from, OffsetDateTime to) {
        return modeTransitionRepository.findByUserIdAndCreatedAtBetweenOrderByCreatedAtAscIdAsc(userId, from, to);
    }

    @Override
    public void recordAuditEvent(String eventName, Map<String, Object> metadata) {
        auditEventService.record(eventName, metadata);
    }
}
