package com.datalab.pairs;

import java.util.ArrayList;
import java.util.List;

import com.datalab.model.Message;
import com.datalab.model.Role;

/**
 * Turns a message sequence into (prompt, completion) pairs, one per answered assistant turn.
 *
 * <p>Each non-blank assistant message is paired with the nearest user message before it. Several assistant
 * messages following one user message each produce their own pair with the same prompt.
 */
public class PairDeriver {
    private final ContextRenderer contextRenderer;

    public PairDeriver() {
        this(new ContextRenderer());
    }

    public PairDeriver(ContextRenderer contextRenderer) {
        this.contextRenderer = contextRenderer;
    }

    public List<ExportPair> derive(List<Message> messages, DerivationPolicy policy) {
        List<ExportPair> pairs = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.kind() != Role.ASSISTANT || message.isBlank()) {
                continue;
            }
            int userIndex = findPreviousUser(messages, i - 1);
            if (userIndex < 0) {
                continue;
            }
            String prompt = prompt(messages, userIndex, policy);
            if (prompt.isEmpty()) {
                continue;
            }
            pairs.add(new ExportPair(prompt, message.trimmedContent()));
        }
        return pairs;
    }

    private String prompt(List<Message> messages, int userIndex, DerivationPolicy policy) {
        switch (policy.context()) {
            case WINDOW:
                return contextRenderer.render(
                        messages, userIndex, policy.includeSystem(), policy.contextTurns(), policy.roleStyle());
            case FULL:
                return contextRenderer.render(messages, userIndex, policy.includeSystem(), 0, policy.roleStyle());
            case NONE:
            default:
                return messages.get(userIndex).trimmedContent();
        }
    }

    private static int findPreviousUser(List<Message> messages, int from) {
        for (int j = from; j >= 0; j--) {
            if (messages.get(j).kind() == Role.USER) {
                return j;
            }
        }
        return -1;
    }
}
