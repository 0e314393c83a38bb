package com.focusflow.backend.modules.mode.domain;

import java.time.OffsetDateTime;
import java.util.Map;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Immutable
@Table(name = "blocked_message")
public class BlockedMessage {

    public static final int MAX_CHANNEL_ID_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "channel_id", updatable = false, length = MAX_CHANNEL_ID_LENGTH)
    private String channelId;

    @Column(name = "message_preview", updatable = false)
    private String messagePreview;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected BlockedMessage() {
    }

    public BlockedMessage(
            String userId,
            Long sessionId,
            String channelId,
            String messagePreview,
            Map<String, Object> payload,
            OffsetDateTime createdAt
    ) {
        this.userId = userId;
        this.sessionId = sessionId;
        // the full value stays in the payload
        this.channelId = channelId != null && channelId.length() > MAX_CHANNEL_ID_LENGTH
                ? channelId.substring(0, MAX_CHANNEL_ID_LENGTH)
                : channelId;
        this.messagePreview = messagePreview;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getMessagePreview() {
        return messagePreview;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
