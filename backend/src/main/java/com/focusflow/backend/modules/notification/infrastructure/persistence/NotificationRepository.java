package com.focusflow.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.focusflow.backend.modules.notification.domain.Notification;
import com.focusflow.backend.modules.notification.domain.NotificationState;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByUserIdAndState(String userId, NotificationState state);

    Optional<Notification> findByUserIdAndDedupeKey(String userId, String dedupeKey);

    Optional<Notification> findByIdAndUserId(UUID id, String userId);

    List<Notification> findByUserIdOrderByCreatedAtAsc(String userId);

    long countByUserIdAndState(String userId, NotificationState state);

    List<Notification> findByUserIdAndTtlAtBeforeAndStateNot(String userId, OffsetDateTime threshold, NotificationState state);

    @Query("""
            select n
              from Notification n
             where n.userId = :userId
               and n.state in :states
             order by case
                        when n.state = com.focusflow.backend.modules.notification.domain.NotificationState.UNREAD then 0
                        when n.state = com.focusflow.backend.modules.notification.domain.NotificationState.READ then 1
                        else 2
                      end,
                      n.createdAt desc
            """)
    Page<Notification> findByUserIdAndStates(
            @Param("userId") String userId,
            @Param("states") List<NotificationState> states,
            Pageable pageable
    );
}
