package com.focusflow.backend.modules.mode.presentation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.mode.domain.IncomingMessage;

import org.springframework.stereotype.Component;

/**
 * Turns the loosely-typed {@code message} field of a request into an {@link IncomingMessage}.
 * A missing message is treated as an empty structured message.
 */
@Component
public class IncomingMessageResolver {

    private static final Set<String> KNOWN_FIELDS = Set.of("text", "channelId", "senderId");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public IncomingMessageResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IncomingMessage resolve(JsonNode message) {
        if (message == null || message.isNull() || message.isMissingNode()) {
            return new IncomingMessage.Structured(null, null, null, Map.of());
        }
        if (message.isTextual()) {
            return new IncomingMessage.Text(message.asText());
        }
        if (!message.isObject()) {
            throw ProblemException.validation("mode.invalid_message", "message must be a string or an object");
        }

        ObjectNode attributes = ((ObjectNode) message).deepCopy();
        attributes.remove(KNOWN_FIELDS);
        Map<String, Object> extra = attributes.isEmpty()
                ? Map.of()
                : new LinkedHashMap<>(objectMapper.convertValue(attributes, MAP_TYPE));

        return new IncomingMessage.Structured(
                textOf(message, "text"),
                textOf(message, "channelId"),
                textOf(message, "senderId"),
                extra
        );
    }

    private static String textOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
