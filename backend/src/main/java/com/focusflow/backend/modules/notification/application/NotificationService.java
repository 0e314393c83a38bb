package com.focusflow.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.notification.domain.Notification;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchLog;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchStatus;
import com.focusflow.backend.modules.notification.domain.NotificationState;
import com.focusflow.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.focusflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationDispatchLogRepository notificationDispatchLogRepository;
    private final int ttlHours;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            NotificationDispatchLogRepository notificationDispatchLogRepository,
            FocusFlowProperties properties,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.notificationDispatchLogRepository = notificationDispatchLogRepository;
        this.ttlHours = properties.notification().ttlHours();
        this.clock = clock;
    }

    public NotificationPageResult getNotifications(String userId, NotificationFilterState filter, Pageable pageable) {
        expireNotifications(userId);

        List<NotificationState> states = switch (filter) {
            case ALL -> List.of(NotificationState.UNREAD, NotificationState.READ);
            case UNREAD -> List.of(NotificationState.UNREAD);
            case READ -> List.of(NotificationState.READ);
        };

        Page<Notification> page = notificationRepository.findByUserIdAndStates(userId, states, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);

        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public void markNotificationRead(String userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> ProblemException.notFound("notification.not_found", "notification not found"));

        if (notification.getState() == NotificationState.EXPIRED) {
            throw new ProblemException(HttpStatus.CONFLICT, "notification.expired");
        }

        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
    }

    public int markAllNotificationsRead(String userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndState(userId, NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    @Transactional(readOnly = true)
    public boolean hasDedupeKey(String userId, String dedupeKey) {
        return notificationRepository.findByUserIdAndDedupeKey(userId, dedupeKey).isPresent();
    }

    /**
     * Stores the message in the user's inbox with an in-app dispatch log entry. Returns empty when a
     * notification with the same dedupe key already exists. Runs in its own transaction so it never
     * rides on, or rolls back with, the caller's.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Notification> deliver(NotificationMessage message) {
        if (message.dedupeKey() != null
                && notificationRepository.findByUserIdAndDedupeKey(message.userId(), message.dedupeKey()).isPresent()) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);

        Notification notification = new Notification();
        notification.setUserId(message.userId());
        notification.setKindCode(message.kindCode());
        notification.setTitle(message.title());
        notification.setBody(message.body());
        notification.setState(NotificationState.UNREAD);
        notification.setDedupeKey(message.dedupeKey());
        notification.setTtlAt(now.plusHours(ttlHours));
        notification.setMetadata(message.metadata() == null ? Map.of() : message.metadata());

        notificationRepository.save(notification);
        saveDispatchLog(notification, NotificationDispatchLog.CHANNEL_IN_APP, NotificationDispatchStatus.SUCCESS, null, null, now);
        return Optional.of(notification);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordDispatch(
            UUID notificationId,
            String channel,
            NotificationDispatchStatus status,
            String errorCode,
            String errorMessage
    ) {
        Notification notification = notificationRepository.getReferenceById(notificationId);
        saveDispatchLog(notification, channel, status, errorCode, errorMessage, OffsetDateTime.now(clock));
    }

    private void saveDispatchLog(
            Notification notification,
            String channel,
            NotificationDispatchStatus status,
            String errorCode,
            String errorMessage,
            OffsetDateTime now
    ) {
        NotificationDispatchLog logEntry = new NotificationDispatchLog();
        logEntry.setNotification(notification);
        logEntry.setChannel(channel);
        logEntry.setStatus(status);
        logEntry.setErrorCode(errorCode);
        logEntry.setErrorMessage(errorMessage);
        logEntry.setLoggedAt(now);
        notificationDispatchLogRepository.save(logEntry);
    }

    private void expireNotifications(String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Notification> expirable = notificationRepository.findByUserIdAndTtlAtBeforeAndStateNot(
                userId,
                now,
                NotificationState.EXPIRED
        );
        if (expirable.isEmpty()) {
            return;
        }
        expirable.forEach(notification -> notification.markExpired(now));
        notificationRepository.saveAll(expirable);
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
