package com.datalab.store;

import java.io.IOException;
import java.util.Optional;

import com.datalab.model.Conversation;
import com.datalab.model.Dataset;
import com.datalab.model.DatasetItem;

/**
 * Read-only access to stored datasets. Every cursor yields records in ascending id order so that a capped
 * export is a stable prefix of the uncapped one.
 */
public interface RecordSource {

    Optional<Dataset> findDataset(long datasetId) throws IOException;

    /**
     * Opens a cursor over conversations matching {@code filter}, each with its full message sequence.
     */
    RecordCursor<Conversation> openConversations(ConversationFilter filter) throws IOException;

    /**
     * Opens a cursor over the items of one dataset. Items have no split or status.
     */
    RecordCursor<DatasetItem> openItems(long datasetId) throws IOException;
}
