package com.focusflow.backend.modules.mode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.focusflow.backend.modules.audit.application.AuditEventService;
import com.focusflow.backend.modules.audit.domain.AuditEvent;
import com.focusflow.backend.modules.mode.application.SessionSummaryAssembler;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.infrastructure.persistence.ModeTransitionRepository;
import com.focusflow.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ModeControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuditEventService auditEventService;

    @Autowired
    private ModeTransitionRepository modeTransitionRepository;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = "user-" + UUID.randomUUID();
    }

    @Test
    void focusLifecycleBlocksMessagesAndRecordsSummary() throws Exception {
        JsonNode started = postJson("/modes/start", """
                {"userId":"%s","durationMinutes":25}
                """.formatted(userId));
        long sessionId = started.path("session").path("id").asLong();
        assertThat(started.path("alreadyActive").asBoolean()).isFalse();
        assertThat(started.path("state").path("currentMode").asText()).isEqualTo("focus");

        JsonNode again = postJson("/modes/start", """
                {"userId":"%s"}
                """.formatted(userId));
        assertThat(again.path("alreadyActive").asBoolean()).isTrue();
        assertThat(again.path("session").path("id").asLong()).isEqualTo(sessionId);

        JsonNode blocked = postJson("/modes/message", """
                {"userId":"%s","message":{"text":"quick question","channelId":"C42","senderId":"U7","thread":"t-1"}}
                """.formatted(userId));
        assertThat(blocked.path("blocked").asBoolean()).isTrue();
        assertThat(blocked.path("interruptionCount").asInt()).isEqualTo(1);

        JsonNode stopped = postJson("/modes/stop", """
                {"userId":"%s"}
                """.formatted(userId));
        assertThat(stopped.path("skipped").asBoolean()).isFalse();
        assertThat(stopped.path("state").path("currentMode").asText()).isEqualTo("break");
        assertThat(stopped.path("summary").path("metrics").path("blockedMessageCount").asInt()).isEqualTo(1);

        mockMvc.perform(get("/modes/current/{userId}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentMode").value("break"))
                .andExpect(jsonPath("$.activeSessionId").doesNotExist());

        List<AuditEvent> summaries = auditEventService.findByEventName(SessionSummaryAssembler.EVENT_SESSION_SUMMARY).stream()
                .filter(event -> userId.equals(event.getMetadata().get("userId")))
                .toList();
        assertThat(summaries).hasSize(1);
        assertThat(summaries.get(0).getMetadata()).containsEntry("reason", "manual_stop");

        assertThat(modeTransitionRepository.findByUserIdOrderByIdAsc(userId))
                .extracting(ModeTransition::getReason)
                .containsExactly("manual_start", "message_blocked", "manual_stop");
    }

    @Test
    void messageOutsideFocusIsDelivered() throws Exception {
        postJson("/modes/set", """
                {"userId":"%s","mode":"break"}
                """.formatted(userId));

        JsonNode result = postJson("/modes/message", """
                {"userId":"%s","message":"lunch?"}
                """.formatted(userId));

        assertThat(result.path("blocked").asBoolean()).isFalse();
        assertThat(result.path("delivered").asBoolean()).isTrue();
        assertThat(result.path("mode").asText()).isEqualTo("break");
    }

    @Test
    void stopWithoutSessionIsSkipped() throws Exception {
        JsonNode result = postJson("/modes/stop", """
                {"userId":"%s"}
                """.formatted(userId));

        assertThat(result.path("skipped").asBoolean()).isTrue();
    }

    @Test
    void unsupportedModeIsRejectedWithoutMutation() throws Exception {
        mockMvc.perform(post("/modes/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s","mode":"gaming"}
                                """.formatted(userId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("mode.unsupported_mode"));

        mockMvc.perform(get("/modes/current/{userId}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentMode").value("idle"));
        assertThat(modeTransitionRepository.findByUserIdOrderByIdAsc(userId)).isEmpty();
    }

    @Test
    void missingUserIdIsRejected() throws Exception {
        mockMvc.perform(post("/modes/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"durationMinutes\":25}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("mode.user_id_required"));
    }

    @Test
    void overlongUserIdIsRejectedBeforeReachingStorage() throws Exception {
        mockMvc.perform(post("/modes/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"" + "u".repeat(65) + "\",\"durationMinutes\":25}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("mode.invalid_user_id"));
    }

    @Test
    void summaryListsRecentSessionsAndBlockedCount() throws Exception {
        postJson("/modes/start", """
                {"userId":"%s","durationMinutes":25}
                """.formatted(userId));
        postJson("/modes/message", """
                {"userId":"%s","message":"ping"}
                """.formatted(userId));
        postJson("/modes/set", """
                {"userId":"%s","mode":"meeting"}
                """.formatted(userId));

        mockMvc.perform(get("/modes/summary/{userId}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentMode").value("meeting"))
                .andExpect(jsonPath("$.activeSession").doesNotExist())
                .andExpect(jsonPath("$.recentSessions.length()").value(1))
                .andExpect(jsonPath("$.blockedMessageCount").value(1));
    }

    @Test
    void catalogListsSeededModesAndRejectsDuplicates() throws Exception {
        mockMvc.perform(get("/modes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.slug == 'focus')].durationMinutes").value(50));

        String slug = "mode-" + UUID.randomUUID().toString().substring(0, 8);
        String body = """
                {"name":"%s","durationMinutes":15,"description":"short sprint"}
                """.formatted(slug);
        mockMvc.perform(post("/modes").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").value(slug));
        mockMvc.perform(post("/modes").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("mode.catalog_duplicate"));
    }

    @Test
    void createModeValidatesBody() throws Exception {
        mockMvc.perform(post("/modes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"durationMinutes\":0}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/modes/current/{userId}", userId).header("X-Request-Id", "req-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-123"));
    }

    private JsonNode postJson(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
