package com.datalab.pairs;

/**
 * How prompts are built for derived pairs.
 *
 * @param includeSystem keep system messages in rendered context
 * @param context which slice of history becomes the prompt
 * @param contextTurns user turns kept by {@link ContextMode#WINDOW}; 0 keeps everything
 * @param roleStyle whether rendered lines carry a role label
 */
public record DerivationPolicy(
        boolean includeSystem,
        ContextMode context,
        int contextTurns,
        RoleStyle roleStyle) {

    public static final int DEFAULT_CONTEXT_TURNS = 6;

    public DerivationPolicy {
        context = context == null ? ContextMode.NONE : context;
        roleStyle = roleStyle == null ? RoleStyle.LABELS : roleStyle;
        contextTurns = Math.max(0, contextTurns);
    }

    public static DerivationPolicy defaults() {
        return new DerivationPolicy(false, ContextMode.NONE, DEFAULT_CONTEXT_TURNS, RoleStyle.LABELS);
    }
}
