package com.datalab.pairs;

import java.util.List;

import com.datalab.model.Message;
import com.datalab.model.Role;

/**
 * Renders the history leading up to a user turn into a single prompt string.
 */
public class ContextRenderer {

    /**
     * @param messages full message sequence of the conversation
     * @param upToIndex index of the user message being answered, inclusive
     * @param includeSystem keep system messages
     * @param contextTurns number of user turns to keep, counting the one at {@code upToIndex}; 0 keeps the
     *        whole prefix
     * @param roleStyle label policy for each rendered line
     * @return newline-joined rendering, empty when every candidate message was filtered out
     */
    public String render(
            List<Message> messages,
            int upToIndex,
            boolean includeSystem,
            int contextTurns,
            RoleStyle roleStyle) {
        if (upToIndex < 0 || upToIndex >= messages.size()) {
            throw new IllegalArgumentException("upToIndex out of range: " + upToIndex);
        }
        int start = windowStart(messages, upToIndex, contextTurns);
        StringBuilder builder = new StringBuilder();
        for (int i = start; i <= upToIndex; i++) {
            Message message = messages.get(i);
            if (message.kind() == Role.SYSTEM && !includeSystem) {
                continue;
            }
            if (message.isBlank()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            if (roleStyle != RoleStyle.PLAIN) {
                builder.append(message.kind().label());
            }
            builder.append(message.trimmedContent());
        }
        return builder.toString();
    }

    static int windowStart(List<Message> messages, int upToIndex, int contextTurns) {
        if (contextTurns <= 0) {
            return 0;
        }
        int turns = 0;
        for (int j = upToIndex; j >= 0; j--) {
            if (messages.get(j).kind() == Role.USER) {
                turns++;
                if (turns >= contextTurns) {
                    return j;
                }
            }
        }
        return 0;
    }
}
