package com.focusflow.backend.modules.mode.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

import com.focusflow.backend.modules.mode.domain.BlockedMessage;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BlockedMessageRepository extends JpaRepository<BlockedMessage, Long> {

    List<BlockedMessage> findBySessionIdOrderByCreatedAtAscIdAsc(Long sessionId);

    long countBySessionIdIn(Collection<Long> sessionIds);

    long countByUserIdAndCreatedAtGreaterThanEqual(String userId, OffsetDateTime since);
}
