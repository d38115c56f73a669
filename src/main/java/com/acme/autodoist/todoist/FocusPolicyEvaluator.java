package com.acme.autodoist.todoist;

import com.acme.autodoist.rule.PolicyDecision;
import com.acme.autodoist.rule.PolicyInput;
import com.acme.autodoist.rule.TaskContext;
import com.acme.autodoist.spi.PolicyEvaluator;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Default focus policy: quiet hours first, then the focus label decides the mode.
 */
@Singleton
public class FocusPolicyEvaluator implements PolicyEvaluator {
    public static final String MODE_ACTIVE_FOCUS = "ACTIVE_FOCUS";
    public static final String MODE_NO_FOCUS_TETHER = "NO_FOCUS_TETHER";

    @Override
    public PolicyDecision evaluate(PolicyInput input) {
        PolicyInput.PolicyConfig config = input.config();
        int hour = input.nowLocal().getHour();
        if (hour < config.allowedHourStart() || hour >= config.allowedHourEnd()) {
            return PolicyDecision.skip("outside_allowed_hours");
        }

        TaskContext task = input.reminderTask();
        if (!PolicyInput.SOURCE_REMINDER.equals(input.source()) || task == null) {
            return focusCandidates(input.focusTasks());
        }
        if (task.hasFocusLabel()) {
            return new PolicyDecision(true, MODE_ACTIVE_FOCUS, "reminder_focus_task", task.id(), List.of(task.id()));
        }
        if (config.requireFocusForReminder()) {
            return PolicyDecision.skip("reminder_without_focus_label");
        }
        return new PolicyDecision(true, MODE_NO_FOCUS_TETHER, "reminder_without_focus", null, List.of(task.id()));
    }

    private static PolicyDecision focusCandidates(List<TaskContext> focusTasks) {
        if (focusTasks.isEmpty()) {
            return new PolicyDecision(true, MODE_NO_FOCUS_TETHER, "no_focus_candidates", null, List.of());
        }
        List<String> ids = focusTasks.stream().map(TaskContext::id).toList();
        return new PolicyDecision(true, MODE_ACTIVE_FOCUS, "focus_task_active", ids.get(0), ids);
    }
}
