package com.focusflow.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.notification.application.NotificationMessage;
import com.focusflow.backend.modules.notification.application.NotificationService;
import com.focusflow.backend.modules.notification.domain.Notification;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchLog;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchStatus;
import com.focusflow.backend.modules.notification.domain.NotificationState;
import com.focusflow.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.focusflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.focusflow.backend.support.TestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationDispatchLogRepository notificationDispatchLogRepository;

    private NotificationService notificationService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        notificationService = new NotificationService(
                notificationRepository,
                notificationDispatchLogRepository,
                TestProperties.defaults(),
                clock
        );
    }

    @Test
    void deliverStoresUnreadNotificationWithTtlAndInAppLog() {
        NotificationMessage message = new NotificationMessage(
                "alice",
                "FOCUS_SESSION_ENDED",
                "Focus session ended",
                "Your focus session (25 mins) has ended. Blocked messages: 2.",
                null,
                Map.of("sessionId", 7L)
        );

        Optional<Notification> stored = notificationService.deliver(message);

        assertThat(stored).isPresent();
        Notification notification = stored.get();
        assertThat(notification.getState()).isEqualTo(NotificationState.UNREAD);
        assertThat(notification.getTtlAt()).isEqualTo(OffsetDateTime.now(clock).plusHours(168));
        assertThat(notification.getMetadata()).containsEntry("sessionId", 7L);
        verify(notificationRepository).save(notification);

        ArgumentCaptor<NotificationDispatchLog> logCaptor = ArgumentCaptor.forClass(NotificationDispatchLog.class);
        verify(notificationDispatchLogRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().getChannel()).isEqualTo(NotificationDispatchLog.CHANNEL_IN_APP);
        assertThat(logCaptor.getValue().getStatus()).isEqualTo(NotificationDispatchStatus.SUCCESS);
    }

    @Test
    void deliverSkipsDuplicateDedupeKey() {
        when(notificationRepository.findByUserIdAndDedupeKey("alice", "DAILY_FOCUS_RECAP:alice:20241231"))
                .thenReturn(Optional.of(new Notification()));

        Optional<Notification> stored = notificationService.deliver(new NotificationMessage(
                "alice", "DAILY_FOCUS_RECAP", "Daily Focus Recap", "body", "DAILY_FOCUS_RECAP:alice:20241231", Map.of()
        ));

        assertThat(stored).isEmpty();
        verify(notificationRepository, never()).save(any(Notification.class));
        verify(notificationDispatchLogRepository, never()).save(any(NotificationDispatchLog.class));
    }

    @Test
    void getNotificationsExpiresStaleEntriesFirst() {
        Notification stale = notification(NotificationState.UNREAD);
        when(notificationRepository.findByUserIdAndTtlAtBeforeAndStateNot("alice", OffsetDateTime.now(clock), NotificationState.EXPIRED))
                .thenReturn(List.of(stale));
        Pageable pageable = PageRequest.of(0, 20);
        when(notificationRepository.findByUserIdAndStates(eq("alice"), anyList(), eq(pageable)))
                .thenReturn(new PageImpl<>(List.of(), pageable, 0));
        when(notificationRepository.countByUserIdAndState("alice", NotificationState.UNREAD)).thenReturn(0L);

        NotificationService.NotificationPageResult result = notificationService.getNotifications(
                "alice",
                NotificationService.NotificationFilterState.ALL,
                pageable
        );

        assertThat(stale.getState()).isEqualTo(NotificationState.EXPIRED);
        assertThat(result.unreadCount()).isZero();
        verify(notificationRepository).saveAll(List.of(stale));
    }

    @Test
    void markReadRejectsUnknownAndExpiredNotifications() {
        UUID missing = UUID.randomUUID();
        UUID expiredId = UUID.randomUUID();
        when(notificationRepository.findByIdAndUserId(missing, "alice")).thenReturn(Optional.empty());
        when(notificationRepository.findByIdAndUserId(expiredId, "alice"))
                .thenReturn(Optional.of(notification(NotificationState.EXPIRED)));

        assertThatThrownBy(() -> notificationService.markNotificationRead("alice", missing))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("notification.not_found");
        assertThatThrownBy(() -> notificationService.markNotificationRead("alice", expiredId))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("notification.expired");
    }

    @Test
    void markAllReadReturnsUpdatedCount() {
        Notification first = notification(NotificationState.UNREAD);
        Notification second = notification(NotificationState.UNREAD);
        when(notificationRepository.findByUserIdAndState("alice", NotificationState.UNREAD))
                .thenReturn(List.of(first, second));

        int updated = notificationService.markAllNotificationsRead("alice");

        assertThat(updated).isEqualTo(2);
        assertThat(first.getState()).isEqualTo(NotificationState.READ);
        assertThat(second.getReadAt()).isEqualTo(OffsetDateTime.now(clock));
    }

    private Notification notification(NotificationState state) {
        Notification notification = new Notification();
        notification.setUserId("alice");
        notification.setKindCode("GENERAL");
        notification.setTitle("title");
        notification.setBody("body");
        notification.setState(state);
        notification.setTtlAt(OffsetDateTime.now(clock).minusHours(1));
        return notification;
    }
}
