package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.focusflow.backend.modules.mode.domain.UserModeState;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserModeStateRepository extends JpaRepository<UserModeState, String> {

    @Modifying
    @Query(value = """
            insert into user_mode_state (user_id, current_mode, active_session_id, updated_at)
            values (:userId, 'IDLE', null, :now)
            on conflict (user_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("userId") String userId, @Param("now") OffsetDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from UserModeState s where s.userId = :userId")
    Optional<UserModeState> findByIdForUpdate(@Param("userId") String userId);
}
