package com.acme.autodoist.rule;

import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.todoist.Comment;
import com.acme.autodoist.todoist.Task;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * When a recurring task is completed, deletes its comments except those starting with a keep marker.
 */
public class RecurringClearCommentsRule implements Rule {
    public static final String NAME = "recurring_clear_comments_on_completion";

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
        String taskId = event.taskId();
        Task task = ctx.tasks().getTask(taskId);
        if (!task.isRecurring()) {
            return RulePlan.skip("not_recurring", taskId);
        }

        List<String> markers = ctx.config().getKeepMarkers().stream()
            .map(m -> m.toLowerCase(Locale.ROOT))
            .toList();

        List<Action> actions = new ArrayList<>();
        int kept = 0;
        for (Comment comment : ctx.tasks().listCommentsForTask(taskId)) {
            String content = comment.content() == null ? "" : comment.content().trim().toLowerCase(Locale.ROOT);
            if (markers.stream().anyMatch(content::startsWith)) {
                kept++;
                continue;
            }
            actions.add(Action.deleteComment(String.valueOf(comment.id()), taskId));
        }

        int cap = Math.max(0, ctx.config().getMaxDeleteComments());
        boolean capHit = actions.size() > cap;
        if (capHit) {
            actions = actions.subList(0, cap);
        }

        var meta = new LinkedHashMap<String, Object>();
        meta.put("task_id", taskId);
        meta.put("is_recurring", true);
        meta.put("kept_count", kept);
        meta.put("delete_count", actions.size());
        meta.put("cap_hit", capHit);
        meta.put("dry_run", ctx.config().isDryRun());
        return new RulePlan(actions, meta);
    }
}
