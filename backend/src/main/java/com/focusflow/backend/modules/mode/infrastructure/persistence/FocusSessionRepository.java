package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import com.focusflow.backend.modules.mode.domain.FocusSession;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FocusSessionRepository extends JpaRepository<FocusSession, Long> {

    List<FocusSession> findByUserIdAndEndedAtIsNullOrderByStartedAtAsc(String userId);

    List<FocusSession> findByUserIdOrderByStartedAtDesc(String userId, Pageable pageable);

    List<FocusSession> findByUserIdAndEndedAtBetweenOrderByEndedAtAsc(
            String userId,
            OffsetDateTime from,
            OffsetDateTime to
    );

    @Query(value = """
            select *
              from focus_session
             where ended_at is null
               and (
                     (expected_end is not null and expected_end <= :now)
                  or (planned_duration_minutes is not null
                      and started_at + make_interval(mins => planned_duration_minutes) <= :now)
               )
             order by started_at asc
            """, nativeQuery = true)
    List<FocusSession> findExpiredOpenSessions(@Param("now") OffsetDateTime now);
}
