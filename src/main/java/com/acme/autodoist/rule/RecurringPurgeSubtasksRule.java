package com.acme.autodoist.rule;

import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.todoist.Task;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * When a recurring task is completed, deletes every descendant subtask, deepest first.
 */
public class RecurringPurgeSubtasksRule implements Rule {
    public static final String NAME = "recurring_purge_subtasks_on_completion";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean matches(TodoistWebhookEvent event) {
        return event.hasTask() && event.isCompletion();
    }

    @Override
    public RulePlan plan(RuleContext ctx, TodoistWebhookEvent event) {
        if (!event.hasTask()) {
            return RulePlan.skip("missing_task_id", null);
        }
        String rootId = event.taskId();
        if (event.projectId() == null || event.projectId().isEmpty()) {
            return RulePlan.skip("missing_project_id", rootId);
        }
        Task parent = ctx.tasks().getTask(rootId);
        if (!parent.isRecurring()) {
            return RulePlan.skip("not_recurring", rootId);
        }

        List<String> descendants = descendants(rootId, ctx.tasks().listActiveTasksForProject(event.projectId()));
        List<String> deepestFirst = new ArrayList<>(descendants);
        Collections.reverse(deepestFirst);

        List<Action> actions = new ArrayList<>();
        for (String id : deepestFirst) {
            actions.add(Action.deleteTask(id));
        }
        int cap = Math.max(0, ctx.config().getMaxDeleteSubtasks());
        boolean capHit = actions.size() > cap;
        if (capHit) {
            actions = actions.subList(0, cap);
        }

        var meta = new LinkedHashMap<String, Object>();
        meta.put("task_id", rootId);
        meta.put("is_recurring", true);
        meta.put("subtasks_found", descendants.size());
        meta.put("delete_count", actions.size());
        meta.put("cap_hit", capHit);
        meta.put("dry_run", ctx.config().isDryRun());
        return new RulePlan(actions, meta);
    }

    /**
     * Descendants of {@code rootId} in discovery order, root excluded. Cycles and repeats are dropped.
     */
    static List<String> descendants(String rootId, List<Task> tasks) {
        Map<String, List<String>> byParent = new HashMap<>();
        for (Task task : tasks) {
            if (task.id() == null || task.id().isEmpty()) {
                continue;
            }
            String parentId = task.parentIdOrNull();
            if (parentId == null) {
                continue;
            }
            byParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(task.id());
        }

        List<String> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(rootId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String child : byParent.getOrDefault(current, List.of())) {
                if (child.equals(rootId) || !seen.add(child)) {
                    continue;
                }
                found.add(child);
                stack.push(child);
            }
        }
        return found;
    }
}
