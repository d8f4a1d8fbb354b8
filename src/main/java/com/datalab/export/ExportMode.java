package com.datalab.export;

import com.datalab.model.DatasetKind;

/**
 * The generation strategy for one export, fixed before streaming starts.
 */
public enum ExportMode {
    CONVERSATION_PAIRS,
    CONVERSATIONS,
    ITEM_PAIRS,
    ITEMS,
    ITEMS_WITH_META;

    /**
     * @param type requested output type
     * @param kind kind of the filtered dataset, or {@code null} when the export spans all datasets
     */
    public static ExportMode resolve(ExportType type, DatasetKind kind) {
        if (kind == DatasetKind.ITEMS) {
            switch (type) {
                case PAIRS:
                    return ITEM_PAIRS;
                case ITEMS:
                    return ITEMS;
                case ITEMS_WITH_META:
                    return ITEMS_WITH_META;
                default:
                    throw new ExportConfigurationException(
                            "type=" + type.value() + " is not valid for items datasets");
            }
        }
        switch (type) {
            case PAIRS:
                return CONVERSATION_PAIRS;
            case CONVERSATIONS:
                return CONVERSATIONS;
            default:
                if (kind == null) {
                    throw new ExportConfigurationException("dataset_id is required for items exports");
                }
                throw new ExportConfigurationException("items export types are only valid for items datasets");
        }
    }
}
