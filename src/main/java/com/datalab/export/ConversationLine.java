package com.datalab.export;

import java.util.List;

import com.datalab.model.Conversation;
import com.datalab.model.Message;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Verbatim conversation as written by the {@code conversations} export. Keys are in sorted order, which is
 * the byte layout downstream consumers already parse.
 */
@JsonPropertyOrder({ "id", "messages", "notes", "source", "split", "status", "tags" })
record ConversationLine(
        long id,
        List<Message> messages,
        String notes,
        String source,
        String split,
        String status,
        List<String> tags) {

    static ConversationLine of(Conversation conversation) {
        return new ConversationLine(
                conversation.id(),
                conversation.messages(),
                conversation.notes(),
                conversation.source(),
                conversation.split(),
                conversation.status(),
                conversation.tags());
    }
}
