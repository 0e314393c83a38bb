package com.focusflow.backend.modules.meeting.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.audit.application.AuditEventService;
import com.focusflow.backend.modules.meeting.domain.MeetingNote;
import com.focusflow.backend.modules.meeting.infrastructure.persistence.MeetingNoteRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class MeetingNoteService {

    private final MeetingNoteRepository meetingNoteRepository;
    private final AuditEventService auditEventService;
    private final Clock clock;

    public MeetingNoteService(MeetingNoteRepository meetingNoteRepository, AuditEventService auditEventService, Clock clock) {
        this.meetingNoteRepository = meetingNoteRepository;
        this.auditEventService = auditEventService;
        this.clock = clock;
    }

    @Transactional
    public MeetingNote logNote(String userId, String text) {
        if (!StringUtils.hasText(text)) {
            throw ProblemException.validation("meeting.note_required", "text is required");
        }
        String author = StringUtils.hasText(userId) ? userId.trim() : null;
        if (author != null && author.length() > MeetingNote.MAX_USER_ID_LENGTH) {
            throw ProblemException.validation("meeting.invalid_user_id",
                    "userId must be at most " + MeetingNote.MAX_USER_ID_LENGTH + " characters");
        }
        MeetingNote note = meetingNoteRepository.save(new MeetingNote(author, text.trim(), OffsetDateTime.now(clock)));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("noteId", note.getId());
        metadata.put("userId", author);
        auditEventService.record(AuditEventService.EVENT_NOTE_LOGGED, metadata);
        return note;
    }
}
