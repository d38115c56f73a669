package com.acme.autodoist.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A planned side effect. Rules produce these; only the executor performs them.
 */
public record Action(ActionType type, String targetType, String targetId, Map<String, Object> meta) {

    public Action {
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public static Action deleteComment(String commentId, String taskId) {
        return new Action(ActionType.DELETE_COMMENT, "comment", commentId, Map.of("task_id", taskId));
    }

    public static Action deleteTask(String taskId) {
        return new Action(ActionType.DELETE_TASK, "task", taskId, Map.of());
    }
}
