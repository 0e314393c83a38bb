package com.focusflow.backend.modules.mode.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.mode.domain.ActivityMode;
import com.focusflow.backend.modules.mode.domain.BlockedMessage;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.IncomingMessage;
import com.focusflow.backend.modules.mode.domain.ModeTransition;
import com.focusflow.backend.modules.mode.domain.TransitionReason;
import com.focusflow.backend.modules.mode.domain.UserModeState;
import com.focusflow.backend.modules.notification.application.NotificationGateway;
import com.focusflow.backend.modules.notification.application.NotificationMessage;
import com.focusflow.backend.support.InMemoryModeStateStore;
import com.focusflow.backend.support.InMemoryModeStateStore.AuditRecord;
import com.focusflow.backend.support.MutableClock;
import com.focusflow.backend.support.TestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    private static final String USER = "user-1";

    @Mock
    private FocusModeCatalogService catalogService;

    @Mock
    private NotificationGateway notificationGateway;

    private MutableClock clock;
    private InMemoryModeStateStore store;
    private SessionLifecycleService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(OffsetDateTime.parse("2025-03-10T09:00:00Z"));
        store = new InMemoryModeStateStore(clock);
        SessionSummaryAssembler assembler = new SessionSummaryAssembler(JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
        lenient().when(catalogService.defaultDurationMinutes()).thenReturn(Optional.empty());
        lenient().when(notificationGateway.notify(any(NotificationMessage.class))).thenReturn(true);
        service = new SessionLifecycleService(
                store,
                catalogService,
                assembler,
                notificationGateway,
                TestProperties.defaults(),
                clock
        );
    }

    @Test
    void startOpensSessionAndEntersFocus() {
        SessionLifecycleService.StartResult result = service.start(USER, 25);

        assertThat(result.alreadyActive()).isFalse();
        assertThat(result.session().plannedDurationMinutes()).isEqualTo(25);
        assertThat(result.session().expectedEnd()).isEqualTo(clock.now().plusMinutes(25));
        assertThat(result.state().currentMode()).isEqualTo("focus");
        assertThat(result.state().activeSessionId()).isEqualTo(result.session().id());
        assertThat(store.transitions(USER))
                .extracting(ModeTransition::getReason)
                .containsExactly("manual_start");
        assertActiveSessionInvariant();
    }

    @Test
    void startUsesCatalogDefaultThenConfiguredDefault() {
        when(catalogService.defaultDurationMinutes()).thenReturn(Optional.of(45));

        assertThat(service.start(USER, null).session().plannedDurationMinutes()).isEqualTo(45);

        service.stop(USER);
        when(catalogService.defaultDurationMinutes()).thenReturn(Optional.empty());

        assertThat(service.start(USER, null).session().plannedDurationMinutes()).isEqualTo(50);
    }

    @Test
    void startTwiceIsIdempotent() {
        SessionLifecycleService.StartResult first = service.start(USER, 25);
        clock.advance(Duration.ofMinutes(3));

        SessionLifecycleService.StartResult second = service.start(USER, 40);

        assertThat(second.alreadyActive()).isTrue();
        assertThat(second.session().id()).isEqualTo(first.session().id());
        assertThat(second.session().plannedDurationMinutes()).isEqualTo(25);
        assertThat(store.sessions(USER)).hasSize(1);
        assertThat(store.transitions(USER)).hasSize(1);
    }

    @Test
    void startRejectsInvalidInputWithoutMutation() {
        assertThatThrownBy(() -> service.start(" ", 25))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("mode.user_id_required");
        assertThatThrownBy(() -> service.start(USER, 0))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("mode.invalid_duration");

        assertThat(store.findState(USER)).isEmpty();
    }

    @Test
    void userIdLongerThanStorageAllowsIsRejectedAsValidation() {
        String tooLong = "u".repeat(65);

        assertThatThrownBy(() -> service.start(tooLong, 25))
                .isInstanceOfSatisfying(ProblemException.class, problem -> {
                    assertThat(problem.getCode()).isEqualTo("mode.invalid_user_id");
                    assertThat(problem.getStatusCode().value()).isEqualTo(400);
                });
        assertThat(service.start("u".repeat(64), 25).alreadyActive()).isFalse();
        assertThat(store.findState(tooLong)).isEmpty();
    }

    @Test
    void startClosesStrayOpenSession() {
        FocusSession stray = store.saveSession(FocusSession.open(USER, "focus", 25, clock.now()));
        clock.advance(Duration.ofMinutes(5));

        SessionLifecycleService.StartResult result = service.start(USER, 25);

        assertThat(stray.isOpen()).isFalse();
        assertThat(result.session().id()).isNotEqualTo(stray.getId());
        assertThat(store.findOpenSessions(USER)).hasSize(1);
        assertThat(store.auditEvents(SessionSummaryAssembler.EVENT_SESSION_SUMMARY)).hasSize(1);
    }

    @Test
    void stopClosesSessionMovesToBreakAndNotifies() {
        service.start(USER, 25);
        clock.advance(Duration.ofMinutes(12));

        SessionLifecycleService.FinalizeResult result = service.stop(USER);

        assertThat(result.skipped()).isFalse();
        assertThat(result.state().currentMode()).isEqualTo("break");
        assertThat(result.state().activeSessionId()).isNull();
        assertThat(result.summary().metrics().actualDurationMinutes()).isEqualTo(12);
        assertThat(store.transitions(USER))
                .extracting(ModeTransition::getReason)
                .containsExactly("manual_start", "manual_stop");

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationGateway).notify(captor.capture());
        assertThat(captor.getValue().userId()).isEqualTo(USER);
        assertThat(captor.getValue().body())
                .isEqualTo("Your focus session (12 mins) has ended. Blocked messages: 0.");
        assertActiveSessionInvariant();
    }

    @Test
    void stopWithoutActiveSessionIsSkipped() {
        SessionLifecycleService.FinalizeResult result = service.stop(USER);

        assertThat(result.skipped()).isTrue();
        assertThat(result.state().currentMode()).isEqualTo("idle");
        verify(notificationGateway, never()).notify(any(NotificationMessage.class));
    }

    @Test
    void doubleFinalizeKeepsFirstEndTime() {
        Long sessionId = service.start(USER, 25).session().id();
        clock.advance(Duration.ofMinutes(10));
        service.finalize(USER, sessionId, FinalizeOptions.silent(TransitionReason.MANUAL_STOP));
        OffsetDateTime endedAt = store.findSession(sessionId).orElseThrow().getEndedAt();
        clock.advance(Duration.ofMinutes(10));

        SessionLifecycleService.FinalizeResult second =
                service.finalize(USER, sessionId, FinalizeOptions.notifying(TransitionReason.SESSION_EXPIRED));

        assertThat(second.skipped()).isTrue();
        assertThat(store.findSession(sessionId).orElseThrow().getEndedAt()).isEqualTo(endedAt);
        assertThat(store.auditEvents(SessionSummaryAssembler.EVENT_SESSION_SUMMARY)).hasSize(1);
        verify(notificationGateway, never()).notify(any(NotificationMessage.class));
    }

    @Test
    void finalizeIgnoresSessionOfAnotherUser() {
        Long sessionId = service.start("other", 25).session().id();

        SessionLifecycleService.FinalizeResult result =
                service.finalize(USER, sessionId, FinalizeOptions.silent(TransitionReason.MANUAL_STOP));

        assertThat(result.skipped()).isTrue();
        assertThat(store.findSession(sessionId).orElseThrow().isOpen()).isTrue();
    }

    @Test
    void notificationFailureNeverSurfaces() {
        doThrow(new IllegalStateException("down")).when(notificationGateway).notify(any(NotificationMessage.class));
        service.start(USER, 25);

        SessionLifecycleService.FinalizeResult result = service.stop(USER);

        assertThat(result.skipped()).isFalse();
        assertThat(store.findState(USER).orElseThrow().getCurrentMode()).isEqualTo(ActivityMode.BREAK);
    }

    @Test
    void racingClosersProduceExactlyOneSummary() throws Exception {
        Long sessionId = service.start(USER, 25).session().id();
        clock.advance(Duration.ofMinutes(25));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Callable<SessionLifecycleService.FinalizeResult>> closers = List.of(
                    () -> service.stop(USER),
                    () -> service.finalize(USER, sessionId, FinalizeOptions.notifying(TransitionReason.SESSION_EXPIRED))
            );
            List<SessionLifecycleService.FinalizeResult> results = new ArrayList<>();
            for (Future<SessionLifecycleService.FinalizeResult> future : executor.invokeAll(closers)) {
                results.add(future.get());
            }

            assertThat(results).filteredOn(SessionLifecycleService.FinalizeResult::skipped).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(store.auditEvents(SessionSummaryAssembler.EVENT_SESSION_SUMMARY)).hasSize(1);
        assertActiveSessionInvariant();
    }

    @Test
    void setModeSwitchesAndClosesOpenSession() {
        Long sessionId = service.start(USER, 25).session().id();
        clock.advance(Duration.ofMinutes(5));

        SessionLifecycleService.SetModeResult result = service.setMode(USER, "meeting");

        assertThat(result.unchanged()).isFalse();
        assertThat(result.state().currentMode()).isEqualTo("meeting");
        assertThat(result.closedSessionIds()).containsExactly(sessionId);
        assertThat(store.findSession(sessionId).orElseThrow().isOpen()).isFalse();

        AuditRecord summary = store.auditEvents(SessionSummaryAssembler.EVENT_SESSION_SUMMARY).get(0);
        assertThat(summary.metadata()).containsEntry("reason", "manual_set");
        assertActiveSessionInvariant();
    }

    @Test
    void setModeToCurrentModeIsUnchanged() {
        service.setMode(USER, "sleep");

        SessionLifecycleService.SetModeResult result = service.setMode(USER, "SLEEP");

        assertThat(result.unchanged()).isTrue();
        assertThat(store.transitions(USER)).hasSize(1);
    }

    @Test
    void setModeRejectsUnknownMode() {
        assertThatThrownBy(() -> service.setMode(USER, "gaming"))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("mode.unsupported_mode");
        assertThatThrownBy(() -> service.setMode(USER, ""))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("mode.mode_required");
        assertThat(store.findState(USER)).isEmpty();
    }

    @Test
    void setModeFocusRoutesThroughStart() {
        SessionLifecycleService.SetModeResult result = service.setMode(USER, "focus");

        assertThat(result.state().currentMode()).isEqualTo("focus");
        assertThat(result.state().activeSession()).isNotNull();
        assertActiveSessionInvariant();
    }

    @Test
    void messageIsBlockedOnlyInFocus() {
        service.setMode(USER, "break");
        IncomingMessage message = new IncomingMessage.Text("standup in 5?");

        SessionLifecycleService.MessageHandlingResult onBreak = service.handleIncomingMessage(USER, message);

        assertThat(onBreak.blocked()).isFalse();
        assertThat(onBreak.delivered()).isTrue();

        service.start(USER, 25);
        SessionLifecycleService.MessageHandlingResult inFocus = service.handleIncomingMessage(USER, message);

        assertThat(inFocus.blocked()).isTrue();
        assertThat(inFocus.delivered()).isFalse();
        assertThat(inFocus.interruptionCount()).isEqualTo(1);
        assertThat(store.findBlockedMessages(inFocus.sessionId()))
                .singleElement()
                .satisfies(blocked -> assertThat(blocked.getMessagePreview()).isEqualTo("standup in 5?"));
        assertThat(store.transitions(USER))
                .extracting(ModeTransition::getReason)
                .endsWith("message_blocked");
    }

    @Test
    void interruptionCountNeverDecreases() {
        service.start(USER, 25);
        int previous = 0;
        for (int i = 0; i < 5; i++) {
            IncomingMessage message = new IncomingMessage.Structured("ping " + i, "C1", "U9", Map.of());
            int count = service.handleIncomingMessage(USER, message).interruptionCount();
            assertThat(count).isEqualTo(previous + 1);
            previous = count;
        }
    }

    @Test
    void blockedMessagePreviewIsTruncated() {
        service.start(USER, 25);
        String longText = "x".repeat(300);

        Long sessionId = service.handleIncomingMessage(USER, new IncomingMessage.Text(longText)).sessionId();

        assertThat(store.findBlockedMessages(sessionId).get(0).getMessagePreview()).hasSize(255);
    }

    @Test
    void oversizedChannelIdIsCutToColumnWidthAndStillBlocked() {
        service.start(USER, 25);
        String channelId = "C".repeat(200);

        SessionLifecycleService.MessageHandlingResult result = service.handleIncomingMessage(
                USER, new IncomingMessage.Structured("hello", channelId, "U9", Map.of()));

        assertThat(result.blocked()).isTrue();
        assertThat(result.interruptionCount()).isEqualTo(1);
        assertThat(store.findBlockedMessages(result.sessionId()))
                .singleElement()
                .satisfies(blocked -> {
                    assertThat(blocked.getChannelId()).hasSize(BlockedMessage.MAX_CHANNEL_ID_LENGTH);
                    assertThat(blocked.getPayload()).containsEntry("channelId", channelId);
                });
    }

    @Test
    void focusWithoutSessionRecoversBeforeBlocking() {
        store.inUserUnitOfWork(USER, state -> {
            state.enterFocus(999L, clock.now());
            return null;
        });

        SessionLifecycleService.MessageHandlingResult result =
                service.handleIncomingMessage(USER, new IncomingMessage.Text("hi"));

        assertThat(result.blocked()).isTrue();
        assertThat(result.sessionId()).isNotEqualTo(999L);
        assertThat(store.findState(USER).orElseThrow().getActiveSessionId()).isEqualTo(result.sessionId());
        assertThat(store.findOpenSessions(USER)).hasSize(1);
    }

    @Test
    void summaryCapturesBlockedMessagesAndTransitions() {
        service.start(USER, 25);
        clock.advance(Duration.ofMinutes(2));
        service.handleIncomingMessage(USER, new IncomingMessage.Structured("lunch?", "C1", "U2", Map.of("thread", "t-1")));
        clock.advance(Duration.ofMinutes(8));

        SessionSummary summary = service.stop(USER).summary();

        assertThat(summary.metrics().interruptions()).isEqualTo(1);
        assertThat(summary.metrics().blockedMessageCount()).isEqualTo(1);
        assertThat(summary.blockedMessages().get(0).channelId()).isEqualTo("C1");
        assertThat(summary.blockedMessages().get(0).payload()).containsEntry("thread", "t-1");
        assertThat(summary.transitions())
                .extracting(SessionSummary.TransitionEntry::reason)
                .containsExactly("manual_start", "message_blocked", "manual_stop");
    }

    @Test
    void resetForNewDayForcesIdleSilently() {
        Long sessionId = service.start(USER, 25).session().id();

        SessionLifecycleService.DailyResetOutcome outcome = service.resetForNewDay(USER);

        assertThat(outcome.previousMode()).isEqualTo(ActivityMode.FOCUS);
        assertThat(outcome.closedSessionIds()).containsExactly(sessionId);
        UserModeState state = store.findState(USER).orElseThrow();
        assertThat(state.getCurrentMode()).isEqualTo(ActivityMode.IDLE);
        assertThat(state.hasActiveSession()).isFalse();
        verify(notificationGateway, never()).notify(any(NotificationMessage.class));
    }

    @Test
    void resetForNewDayLeavesIdleUserUntouched() {
        service.setMode(USER, "meeting");
        service.resetForNewDay(USER);
        int transitions = store.transitions(USER).size();

        service.resetForNewDay(USER);

        assertThat(store.transitions(USER)).hasSize(transitions);
    }

    @Test
    void getCurrentModeDefaultsToIdleWithoutCreatingState() {
        ModeStateView view = service.getCurrentMode(USER);

        assertThat(view.currentMode()).isEqualTo("idle");
        assertThat(store.findState(USER)).isEmpty();
    }

    @Test
    void getSummaryListsRecentSessionsAndBlockedCount() {
        service.start(USER, 25);
        service.handleIncomingMessage(USER, new IncomingMessage.Text("a"));
        service.handleIncomingMessage(USER, new IncomingMessage.Text("b"));
        clock.advance(Duration.ofMinutes(30));
        service.stop(USER);
        service.start(USER, 25);

        SessionLifecycleService.ModeSummaryView summary = service.getSummary(USER);

        assertThat(summary.currentMode()).isEqualTo("focus");
        assertThat(summary.activeSession()).isNotNull();
        assertThat(summary.recentSessions()).hasSize(2);
        assertThat(summary.blockedMessageCount()).isEqualTo(2);
        assertThat(summary.blockedMessagesSince()).isEqualTo(clock.now().minusDays(7));
    }

    private void assertActiveSessionInvariant() {
        for (UserModeState state : store.findAllStates()) {
            assertThat(state.hasActiveSession())
                    .as("active session iff focus for %s", state.getUserId())
                    .isEqualTo(state.isFocused());
        }
    }
}
