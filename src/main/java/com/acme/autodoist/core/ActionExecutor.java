package com.acme.autodoist.core;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.rule.Action;
import com.acme.autodoist.spi.ActionResult;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.TaskClient;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs planned actions against the task tracker or notification hook and records each outcome.
 * Remote failures propagate; nothing is recorded for an action that did not complete.
 */
@Singleton
public class ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ActionExecutor.class);

    private final TaskClient tasks;
    private final ReceiptLedger ledger;
    private final EventsConfig config;
    private final Clock clock;

    public ActionExecutor(TaskClient tasks, ReceiptLedger ledger, EventsConfig config, Clock clock) {
        this.tasks = tasks;
        this.ledger = ledger;
        this.config = config;
        this.clock = clock;
    }

    public ActionResult execute(String deliveryId, String ruleName, Action action) {
        if (config.isDryRun()) {
            ledger.recordAction(deliveryId, ruleName, action.type().wire(), action.targetType(), action.targetId(),
                ActionResult.SKIPPED, Jsons.merge(action.meta(), Map.of("reason", "dry_run")));
            return ActionResult.SKIPPED;
        }

        Map<String, Object> meta = action.meta();
        switch (action.type()) {
            case DELETE_COMMENT -> tasks.deleteComment(action.targetId());
            case DELETE_TASK -> tasks.deleteTask(action.targetId());
            case NOTIFY_WEBHOOK -> meta = notifyWebhook(action);
        }
        LOG.debug("delivery={} rule={} {} {} done", deliveryId, ruleName, action.type().wire(), action.targetId());
        ledger.recordAction(deliveryId, ruleName, action.type().wire(), action.targetType(), action.targetId(),
            ActionResult.SUCCESS, meta);
        return ActionResult.SUCCESS;
    }

    private Map<String, Object> notifyWebhook(Action action) {
        int status = tasks.postWebhook(action.targetId(), Jsons.asMap(action.meta().get("payload")),
            config.getReminderWebhookToken());
        if (status < 200 || status >= 300) {
            throw new TaskApiException("Notification webhook returned " + status, status);
        }
        Object taskId = action.meta().get("task_id");
        Object mode = action.meta().get("policy_mode");
        if (taskId != null && mode != null) {
            ledger.recordReminderNotification(taskId.toString(), mode.toString(), clock.instant());
        }
        return Jsons.merge(action.meta(), Map.of("webhook_status", status));
    }
}
