package com.datalab.pairs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.datalab.model.Message;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The two item shapes that carry trainable dialogue.
 */
public interface ItemPayload {

    List<ExportPair> derive(PairDeriver pairDeriver, DerivationPolicy policy);

    /**
     * Recognizes {@code {"user": ..., "assistant": ...}} first, then {@code {"messages": [...]}}. Any other
     * value, including a malformed {@code messages} array, is not a payload.
     */
    static Optional<ItemPayload> parse(JsonNode data, ObjectMapper mapper) {
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }
        JsonNode user = data.get("user");
        JsonNode assistant = data.get("assistant");
        if (user != null && assistant != null && user.isTextual() && assistant.isTextual()) {
            String prompt = user.textValue().strip();
            String completion = assistant.textValue().strip();
            if (!prompt.isEmpty() && !completion.isEmpty()) {
                return Optional.of(new SingleTurn(prompt, completion));
            }
        }
        JsonNode messages = data.get("messages");
        if (messages == null) {
            return Optional.empty();
        }
        return readMessages(messages, mapper).map(MultiTurn::new);
    }

    private static Optional<List<Message>> readMessages(JsonNode node, ObjectMapper mapper) {
        if (node.isNull()) {
            return Optional.of(List.of());
        }
        if (!node.isArray()) {
            return Optional.empty();
        }
        try {
            List<Message> parsed = mapper.convertValue(node, new TypeReference<List<Message>>() {
            });
            List<Message> messages = new ArrayList<>(parsed.size());
            for (Message message : parsed) {
                messages.add(message == null ? new Message(null, null, null, null) : message);
            }
            return Optional.of(messages);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    record SingleTurn(String user, String assistant) implements ItemPayload {
        @Override
        public List<ExportPair> derive(PairDeriver pairDeriver, DerivationPolicy policy) {
            return List.of(new ExportPair(user, assistant));
        }
    }

    record MultiTurn(List<Message> messages) implements ItemPayload {
        @Override
        public List<ExportPair> derive(PairDeriver pairDeriver, DerivationPolicy policy) {
            if (messages.isEmpty()) {
                return List.of();
            }
            return pairDeriver.derive(messages, policy);
        }
    }
}
