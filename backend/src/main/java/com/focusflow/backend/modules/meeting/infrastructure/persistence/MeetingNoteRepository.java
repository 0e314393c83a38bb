package com.focusflow.backend.modules.meeting.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

import com.focusflow.backend.modules.meeting.domain.MeetingNote;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingNoteRepository extends JpaRepository<MeetingNote, Long> {

    @Query("""
            select n
              from MeetingNote n
             where n.summarized = false
               and n.userId is not null
               and n.createdAt >= :since
             order by n.createdAt asc, n.id asc
            """)
    List<MeetingNote> findPendingSince(@Param("since") OffsetDateTime since, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("""
            update MeetingNote n
               set n.summarized = true,
                   n.summarizedAt = :now
             where n.id in :ids
               and n.summarized = false
            """)
    int markSummarized(@Param("ids") Collection<Long> ids, @Param("now") OffsetDateTime now);
}
