package com.focusflow.backend.global.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Policy constants for sessions, background jobs and the two outbound gateways.
 */
@Validated
@ConfigurationProperties(prefix = "focusflow")
public record FocusFlowProperties(
        @Valid @NotNull @DefaultValue Session session,
        @Valid @NotNull @DefaultValue Jobs jobs,
        @Valid @NotNull @DefaultValue Notification notification,
        @Valid @NotNull @DefaultValue Summarizer summarizer
) {

    public record Session(
            @Positive @DefaultValue("50") int defaultDurationMinutes,
            @Positive @DefaultValue("255") int messagePreviewLength,
            @Positive @DefaultValue("10") int recentSessionLimit,
            @NotNull @DefaultValue("P7D") Duration blockedMessageLookback
    ) {
    }

    public record Jobs(
            @DefaultValue("true") boolean enabled,
            @Valid @NotNull @DefaultValue ExpirySweep expirySweep,
            @Valid @NotNull @DefaultValue DailyReset dailyReset,
            @Valid @NotNull @DefaultValue MeetingSummary meetingSummary
    ) {
    }

    public record ExpirySweep(
            @NotNull @DefaultValue("PT1M") Duration interval
    ) {
    }

    public record DailyReset(
            @NotNull @DefaultValue("00:00") LocalTime time,
            @NotNull @DefaultValue("UTC") ZoneId zone,
            @NotNull @DefaultValue("ACTIVE_ONLY") RecapPolicy recapPolicy
    ) {

        public String cronExpression() {
            return "0 " + time.getMinute() + " " + time.getHour() + " * * *";
        }
    }

    public record MeetingSummary(
            @NotNull @DefaultValue("PT30M") Duration interval,
            @NotNull @DefaultValue("PT180M") Duration window,
            @Min(1) @Max(500) @DefaultValue("200") int batchLimit
    ) {
    }

    public record Notification(
            @Positive @DefaultValue("168") int ttlHours,
            @Valid @NotNull @DefaultValue Webhook webhook
    ) {
    }

    public record Webhook(
            @DefaultValue("false") boolean enabled,
            String url,
            @NotNull @DefaultValue("PT5S") Duration timeout
    ) {
    }

    public record Summarizer(
            @NotNull @DefaultValue("http://localhost:8000") String baseUrl,
            @NotNull @DefaultValue("PT30S") Duration timeout
    ) {
    }

    public enum RecapPolicy {
        ACTIVE_ONLY,
        ALWAYS
    }
}
