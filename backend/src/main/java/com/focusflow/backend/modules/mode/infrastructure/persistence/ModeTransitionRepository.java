package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import com.focusflow.backend.modules.mode.domain.ModeTransition;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ModeTransitionRepository extends JpaRepository<ModeTransition, Long> {

    List<ModeTransition> findByUserIdAndCreatedAtBetweenOrderByCreatedAtAscIdAsc(
            String userId,
            OffsetDateTime from,
            OffsetDateTime to
    );

    List<ModeTransition> findByUserIdOrderByIdAsc(String userId);
}
