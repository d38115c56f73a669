package com.acme.autodoist.rule;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.todoist.Due;
import com.acme.autodoist.todoist.Task;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards a fired reminder to the notification hook when the focus policy allows it and the
 * task/mode pair is outside its cooldown.
 */
public class ReminderNotifyRule implements Rule {
    public static final String NAME = "reminder_notify";
    static final String HOOK_NAME = "Focus Follow-up";
    private static final Logger LOG = LoggerFactory.getLogger(ReminderNotifyRule.class);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean matches(TodoistWebhookEvent event) {
        return TodoistWebhookEvent.REMINDER_FIRED.equals(event.eventName()) && event.hasTask();
    }

    @Override
    public RulePlan plan(RuleContext ctx, TodoistWebhookEvent event) {
        EventsConfig config = ctx.config();
        if (!event.hasTask()) {
            return RulePlan.skip("missing_task_id", null);
        }
        String taskId = event.taskId();
        if (isBlank(config.getReminderWebhookUrl())) {
            return RulePlan.skip("missing_webhook_url", taskId);
        }
        if (isBlank(config.getReminderWebhookToken())) {
            return RulePlan.skip("missing_webhook_token", taskId);
        }

        ZoneId zone = zone(config.getReminderTimezone());
        Task task = ctx.tasks().getTask(taskId);
        TaskContext taskCtx = taskContext(task, taskId, zone);
        ZonedDateTime now = ZonedDateTime.now(ctx.clock().withZone(zone));

        var policyConfig = new PolicyInput.PolicyConfig(config.isReminderRequireFocusLabel(), 0, 24);
        PolicyDecision decision = ctx.policy().evaluate(
            new PolicyInput(PolicyInput.SOURCE_REMINDER, now, List.of(), taskCtx, policyConfig));
        if (!decision.shouldNotify()) {
            var meta = new LinkedHashMap<String, Object>();
            meta.put("reason", decision.reason());
            meta.put("task_id", taskId);
            meta.put("mode", decision.mode());
            return RulePlan.skip(meta);
        }

        int cooldownMinutes = Math.max(0, config.getReminderCooldownMinutes());
        Optional<Instant> lastSent = ctx.ledger().lastReminderNotification(taskId, decision.mode());
        if (lastSent.isPresent() && cooldownMinutes > 0
            && Duration.between(lastSent.get(), now.toInstant()).compareTo(Duration.ofMinutes(cooldownMinutes)) < 0) {
            var meta = new LinkedHashMap<String, Object>();
            meta.put("reason", "cooldown_active");
            meta.put("task_id", taskId);
            meta.put("mode", decision.mode());
            meta.put("cooldown_minutes", cooldownMinutes);
            meta.put("last_sent_at", lastSent.get().toString());
            return RulePlan.skip(meta);
        }

        PolicyDecision messageDecision = messageDecision(decision, taskCtx, now);
        var input = new PolicyInput(PolicyInput.SOURCE_REMINDER, now, List.of(taskCtx), taskCtx, policyConfig);
        String projectId = event.projectId() != null ? event.projectId() : task.projectId();

        var hookMeta = new LinkedHashMap<String, Object>();
        hookMeta.put("source", "autodoist-events-worker");
        hookMeta.put("event_name", event.eventName());
        hookMeta.put("task_id", taskId);
        hookMeta.put("project_id", projectId);
        hookMeta.put("reminder_id", event.reminderId());
        hookMeta.put("triggered_at", event.triggeredAt());
        hookMeta.put("policy_mode", decision.mode());
        hookMeta.put("policy_reason", decision.reason());
        hookMeta.put("message_mode", messageDecision.mode());
        hookMeta.put("message_reason", messageDecision.reason());

        Map<String, Object> payload = ReminderMessages.hookPayload(
            ReminderMessages.message(messageDecision, input),
            config.getReminderTo(),
            isBlank(config.getReminderChannel()) ? "discord" : config.getReminderChannel(),
            HOOK_NAME);
        payload.put("meta", hookMeta);

        var actionMeta = new LinkedHashMap<String, Object>();
        actionMeta.put("task_id", taskId);
        actionMeta.put("event_name", event.eventName());
        actionMeta.put("policy_mode", decision.mode());
        actionMeta.put("message_mode", messageDecision.mode());
        actionMeta.put("cooldown_minutes", cooldownMinutes);
        actionMeta.put("payload", payload);
        var action = new Action(ActionType.NOTIFY_WEBHOOK, "webhook", config.getReminderWebhookUrl(), actionMeta);

        var meta = new LinkedHashMap<String, Object>();
        meta.put("task_id", taskId);
        meta.put("reminder_id", event.reminderId());
        meta.put("webhook_url_set", true);
        meta.put("has_focus_label", taskCtx.hasFocusLabel());
        meta.put("policy_mode", decision.mode());
        meta.put("policy_reason", decision.reason());
        meta.put("message_mode", messageDecision.mode());
        meta.put("message_reason", messageDecision.reason());
        meta.put("cooldown_minutes", cooldownMinutes);
        meta.put("dry_run", config.isDryRun());
        return new RulePlan(List.of(action), meta);
    }

    /**
     * A reminder that fires before the task is due is framed as preparation, without changing
     * the policy decision that gated it.
     */
    static PolicyDecision messageDecision(PolicyDecision decision, TaskContext task, ZonedDateTime now) {
        if (task.dueDateTimeLocal() != null && task.dueDateTimeLocal().isAfter(now)) {
            return decision.withMode(PolicyDecision.MODE_PREP_WINDOW, "reminder_before_due_datetime");
        }
        if (task.dueDate() != null && task.dueDate().isAfter(now.toLocalDate())) {
            return decision.withMode(PolicyDecision.MODE_PREP_WINDOW, "reminder_before_due_date");
        }
        return decision;
    }

    public static TaskContext taskContext(Task task, String taskId, ZoneId zone) {
        Set<String> labels = new LinkedHashSet<>();
        for (String label : task.labels()) {
            if (label != null && !label.isBlank()) {
                labels.add(label.trim().toLowerCase(Locale.ROOT));
            }
        }
        Due due = task.due();
        String content = task.content() == null ? "" : task.content().trim();
        return new TaskContext(
            taskId,
            content.isEmpty() ? taskId : content,
            labels,
            task.projectId(),
            due == null ? null : parseDueDate(due.date()),
            due == null ? null : parseDueDateTime(due.datetime(), zone),
            isBlank(task.url()) ? null : task.url()
        );
    }

    static LocalDate parseDueDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Offset-less values are taken as local to {@code zone}; malformed values count as absent.
     */
    static ZonedDateTime parseDueDateTime(String value, ZoneId zone) {
        if (isBlank(value)) {
            return null;
        }
        String normalized = value.endsWith("Z") ? value.substring(0, value.length() - 1) + "+00:00" : value;
        try {
            return OffsetDateTime.parse(normalized).atZoneSameInstant(zone);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(normalized).atZone(zone);
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }

    public static ZoneId zone(String name) {
        try {
            return ZoneId.of(isBlank(name) ? EventsConfig.DEFAULT_TIMEZONE : name);
        } catch (DateTimeException e) {
            LOG.warn("Unknown reminder timezone '{}', using {}", name, EventsConfig.DEFAULT_TIMEZONE);
            return ZoneId.of(EventsConfig.DEFAULT_TIMEZONE);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
