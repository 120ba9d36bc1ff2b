package com.prqlc.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The list of diagnostics returned for a failed compilation.
 */
public final class ErrorMessages {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final List<ErrorMessage> messages;

    public ErrorMessages(List<ErrorMessage> messages) {
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    /**
     * Wraps a single exception raised while compiling {@code source}.
     */
    public static ErrorMessages from(PrqlException e, String source) {
        return new ErrorMessages(List.of(ErrorMessage.from(e, source)));
    }

    public List<ErrorMessage> messages() {
        return messages;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Serializes the messages as {@code {"inner": [...]}}.
     */
    public String toJson() {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode inner = root.putArray("inner");
        for (ErrorMessage message : messages) {
            inner.add(message.toJson(objectMapper));
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error messages", e);
        }
    }

    @Override
    public String toString() {
        return messages.stream().map(ErrorMessage::toString).collect(Collectors.joining("\n"));
    }
}
