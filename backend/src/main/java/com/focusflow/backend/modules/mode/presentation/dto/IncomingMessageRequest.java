package com.focusflow.backend.modules.mode.presentation.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code message} is either a JSON string or an object such as {@code {"text", "channelId", "senderId"}}.
 */
public record IncomingMessageRequest(
        String userId,
        JsonNode message
) {
}
