package com.focusflow.backend.modules.mode.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An inbound message after it has been resolved at the request boundary: either bare text or a
 * structured message with a channel and sender.
 */
public sealed interface IncomingMessage permits IncomingMessage.Text, IncomingMessage.Structured {

    String text();

    String channelId();

    Map<String, Object> toPayload();

    /**
     * Message text cut to {@code maxLength} characters, or {@code null} when there is no text.
     */
    default String preview(int maxLength) {
        String text = text();
        if (text == null) {
            return null;
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    record Text(String text) implements IncomingMessage {

        @Override
        public String channelId() {
            return null;
        }

        @Override
        public Map<String, Object> toPayload() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("text", text);
            return payload;
        }
    }

    record Structured(
            String text,
            String channelId,
            String senderId,
            Map<String, Object> attributes
    ) implements IncomingMessage {

        public Structured {
            attributes = attributes == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        @Override
        public Map<String, Object> toPayload() {
            Map<String, Object> payload = new LinkedHashMap<>(attributes);
            payload.put("text", text);
            payload.put("channelId", channelId);
            payload.put("senderId", senderId);
            return payload;
        }
    }
}
