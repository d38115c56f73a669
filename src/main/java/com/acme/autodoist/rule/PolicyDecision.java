package com.acme.autodoist.rule;

import java.util.List;

public record PolicyDecision(
    boolean shouldNotify,
    String mode,
    String reason,
    String focusTaskId,
    List<String> candidateTaskIds
) {
    public static final String MODE_SKIP = "SKIP";
    public static final String MODE_PREP_WINDOW = "ACTIVE_FOCUS_PREP_WINDOW";

    public PolicyDecision {
        candidateTaskIds = candidateTaskIds == null ? List.of() : List.copyOf(candidateTaskIds);
    }

    public static PolicyDecision skip(String reason) {
        return new PolicyDecision(false, MODE_SKIP, reason, null, List.of());
    }

    /**
     * Same gating outcome, different framing for the outbound message.
     */
    public PolicyDecision withMode(String newMode, String newReason) {
        return new PolicyDecision(shouldNotify, newMode, newReason, focusTaskId, candidateTaskIds);
    }
}
