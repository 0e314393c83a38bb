package com.focusflow.backend.modules.meeting.presentation;

import com.focusflow.backend.modules.meeting.application.MeetingNoteService;
import com.focusflow.backend.modules.meeting.domain.MeetingNote;
import com.focusflow.backend.modules.meeting.presentation.dto.LogMeetingNoteRequest;
import com.focusflow.backend.modules.meeting.presentation.dto.MeetingNoteResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/meeting-notes")
public class MeetingNoteController {

    private final MeetingNoteService meetingNoteService;

    public MeetingNoteController(MeetingNoteService meetingNoteService) {
        this.meetingNoteService = meetingNoteService;
    }

    @Operation(summary = "회의 노트 기록", description = "요약 배치가 처리할 회의 노트를 저장한다.")
    @PostMapping
    public ResponseEntity<MeetingNoteResponse> logNote(@RequestBody LogMeetingNoteRequest request) {
        MeetingNote note = meetingNoteService.logNote(request.userId(), request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(new MeetingNoteResponse(
                note.getId(),
                note.getUserId(),
                note.getBody(),
                note.isSummarized(),
                note.getCreatedAt()
        ));
    }
}
