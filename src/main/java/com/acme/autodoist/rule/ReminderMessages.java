package com.acme.autodoist.rule;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text and hook payload for reminder notifications.
 */
public final class ReminderMessages {
    private static final DateTimeFormatter DUE_AT = DateTimeFormatter.ofPattern("EEE MMM d, h:mm a", Locale.US);
    private static final DateTimeFormatter DUE_ON = DateTimeFormatter.ofPattern("EEE MMM d", Locale.US);

    private ReminderMessages() {
    }

    public static String message(PolicyDecision decision, PolicyInput input) {
        TaskContext task = input.reminderTask();
        StringBuilder sb = new StringBuilder();
        if (PolicyDecision.MODE_PREP_WINDOW.equals(decision.mode())) {
            sb.append("Heads up: \"").append(task.content()).append("\" is coming up");
            String due = dueText(task);
            if (due != null) {
                sb.append(" (due ").append(due).append(")");
            }
            sb.append(". Use the time before it starts to prepare: what is the first concrete step?");
        } else {
            sb.append("Reminder: \"").append(task.content()).append("\" is due now. ");
            if (task.hasFocusLabel()) {
                sb.append("It is one of your focus tasks; start on it or reschedule it deliberately.");
            } else {
                sb.append("Start it now, or decide when you will.");
            }
        }
        if (task.url() != null) {
            sb.append("\n").append(task.url());
        }
        sb.append("\n[mode=").append(decision.mode()).append(" reason=").append(decision.reason()).append("]");
        return sb.toString();
    }

    /**
     * Check-in text for a scheduled trigger: names the first focus candidate, or asks for one.
     */
    public static String triggerMessage(PolicyDecision decision, List<TaskContext> focusTasks) {
        StringBuilder sb = new StringBuilder();
        TaskContext focus = focusTasks.stream()
            .filter(t -> t.id().equals(decision.focusTaskId()))
            .findFirst()
            .orElse(null);
        if (focus != null) {
            sb.append("Focus check-in: \"").append(focus.content()).append("\" is your focus task. ");
            sb.append("What is the next concrete step?");
            if (focus.url() != null) {
                sb.append("\n").append(focus.url());
            }
        } else {
            sb.append("Focus check-in: nothing is labeled focus right now. ");
            sb.append("Pick one task for the next block and label it.");
        }
        sb.append("\n[mode=").append(decision.mode()).append(" reason=").append(decision.reason()).append("]");
        return sb.toString();
    }

    /**
     * Payload for the agent hook; {@code to} is left out when no recipient is configured.
     */
    public static Map<String, Object> hookPayload(String message, String to, String channel, String name) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("message", message);
        payload.put("name", name);
        payload.put("channel", channel);
        if (to != null && !to.isBlank()) {
            payload.put("to", to);
        }
        payload.put("deliver", true);
        return payload;
    }

    private static String dueText(TaskContext task) {
        if (task.dueDateTimeLocal() != null) {
            return DUE_AT.format(task.dueDateTimeLocal());
        }
        if (task.dueDate() != null) {
            return DUE_ON.format(task.dueDate());
        }
        return null;
    }
}
