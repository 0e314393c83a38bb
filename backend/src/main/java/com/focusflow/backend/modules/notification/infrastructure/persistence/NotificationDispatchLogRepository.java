package com.focusflow.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.focusflow.backend.modules.notification.domain.NotificationDispatchLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationDispatchLogRepository extends JpaRepository<NotificationDispatchLog, Long> {

    List<NotificationDispatchLog> findByNotification_Id(UUID notificationId);
}
