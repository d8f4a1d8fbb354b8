package com.datalab.export;

import com.datalab.pairs.ContextMode;
import com.datalab.pairs.DerivationPolicy;
import com.datalab.pairs.RoleStyle;
import com.datalab.store.ConversationFilter;

/**
 * Request configuration for one export. Built fresh per request and never persisted.
 *
 * @param type output encoding
 * @param datasetId dataset filter; 0 exports across all datasets
 * @param split conversation split, or {@code all}
 * @param status conversation status
 * @param includeSystem keep system messages in rendered context
 * @param context prompt context policy for pair exports
 * @param contextTurns user turns kept by the window context policy
 * @param roleStyle role label policy for rendered context
 * @param maxExamples global cap on emitted lines; 0 is unlimited
 */
public record ExportOptions(
        ExportType type,
        long datasetId,
        String split,
        String status,
        boolean includeSystem,
        ContextMode context,
        int contextTurns,
        RoleStyle roleStyle,
        int maxExamples) {

    public static final String DEFAULT_SPLIT = "train";
    public static final String DEFAULT_STATUS = "approved";

    public ExportOptions {
        type = type == null ? ExportType.PAIRS : type;
        datasetId = Math.max(0L, datasetId);
        split = split == null || split.isBlank() ? DEFAULT_SPLIT : split.strip();
        status = status == null || status.isBlank() ? DEFAULT_STATUS : status.strip();
        context = context == null ? ContextMode.NONE : context;
        contextTurns = Math.max(0, contextTurns);
        roleStyle = roleStyle == null ? RoleStyle.LABELS : roleStyle;
        maxExamples = Math.max(0, maxExamples);
    }

    public static ExportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasDatasetFilter() {
        return datasetId > 0;
    }

    public DerivationPolicy derivationPolicy() {
        return new DerivationPolicy(includeSystem, context, contextTurns, roleStyle);
    }

    public ConversationFilter conversationFilter() {
        return new ConversationFilter(datasetId, split, status);
    }

    public static final class Builder {
        private ExportType type = ExportType.PAIRS;
        private long datasetId;
        private String split = DEFAULT_SPLIT;
        private String status = DEFAULT_STATUS;
        private boolean includeSystem;
        private ContextMode context = ContextMode.NONE;
        private int contextTurns = DerivationPolicy.DEFAULT_CONTEXT_TURNS;
        private RoleStyle roleStyle = RoleStyle.LABELS;
        private int maxExamples;

        private Builder() {
        }

        public Builder type(ExportType type) {
            this.type = type;
            return this;
        }

        public Builder datasetId(long datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder split(String split) {
            this.split = split;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder includeSystem(boolean includeSystem) {
            this.includeSystem = includeSystem;
            return this;
        }

        public Builder context(ContextMode context) {
            this.context = context;
            return this;
        }

        public Builder contextTurns(int contextTurns) {
            this.contextTurns = contextTurns;
            return this;
        }

        public Builder roleStyle(RoleStyle roleStyle) {
            this.roleStyle = roleStyle;
            return this;
        }

        public Builder maxExamples(int maxExamples) {
            this.maxExamples = maxExamples;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(
                    type,
                    datasetId,
                    split,
                    status,
                    includeSystem,
                    context,
                    contextTurns,
                    roleStyle,
                    maxExamples);
        }
    }
}
