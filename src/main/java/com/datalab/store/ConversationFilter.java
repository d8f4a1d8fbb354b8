package com.datalab.store;

import com.datalab.model.Conversation;

/**
 * Exact-match filter over conversations. A {@code datasetId} of 0 matches every dataset and a split of
 * {@value #ALL_SPLITS} (or blank) matches every split.
 */
public record ConversationFilter(long datasetId, String split, String status) {
    public static final String ALL_SPLITS = "all";

    public ConversationFilter {
        split = split == null ? "" : split;
        status = status == null ? "" : status;
    }

    public boolean matchesAnySplit() {
        return split.isEmpty() || ALL_SPLITS.equals(split);
    }

    public boolean matches(Conversation conversation) {
        if (!status.equals(conversation.status())) {
            return false;
        }
        if (datasetId > 0 && conversation.datasetId() != datasetId) {
            return false;
        }
        return matchesAnySplit() || split.equals(conversation.split());
    }
}
