package com.acme.autodoist.rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of planning: the actions to perform and metadata describing the decision.
 * A skip is a plan with no actions and a {@code reason}.
 */
public record RulePlan(List<Action> actions, Map<String, Object> meta) {

    public RulePlan {
        actions = List.copyOf(actions);
        meta = new LinkedHashMap<>(meta);
    }

    public static RulePlan skip(String reason, String taskId) {
        var meta = new LinkedHashMap<String, Object>();
        meta.put("reason", reason);
        if (taskId != null) {
            meta.put("task_id", taskId);
        }
        return new RulePlan(List.of(), meta);
    }

    public static RulePlan skip(Map<String, Object> meta) {
        return new RulePlan(List.of(), meta);
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }
}
