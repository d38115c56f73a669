package com.acme.autodoist.core;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.rule.ActionType;
import com.acme.autodoist.rule.PolicyDecision;
import com.acme.autodoist.rule.PolicyInput;
import com.acme.autodoist.rule.ReminderMessages;
import com.acme.autodoist.rule.ReminderNotifyRule;
import com.acme.autodoist.rule.TaskContext;
import com.acme.autodoist.spi.ActionResult;
import com.acme.autodoist.spi.PolicyEvaluator;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.ReceiptLedger.NewReceipt;
import com.acme.autodoist.spi.ReceiptStatus;
import com.acme.autodoist.spi.TaskClient;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduled focus check-in, run from outside on a timer. Evaluates the focus policy over every
 * active task, optionally posts the result to the notification hook, and audits each run as a
 * receipt with an {@code internal-} id.
 */
@Singleton
public class FocusTriggerService {
    private static final Logger LOG = LoggerFactory.getLogger(FocusTriggerService.class);
    public static final String DEFAULT_SOURCE = "cron_fallback";
    static final String EVENT_NAME = "internal:trigger";
    static final String RULE_NAME = "internal_trigger";
    static final String HOOK_NAME = "Focus Check-in";

    private final TaskClient tasks;
    private final ReceiptLedger ledger;
    private final PolicyEvaluator policy;
    private final EventsConfig config;
    private final Clock clock;

    public FocusTriggerService(TaskClient tasks, ReceiptLedger ledger, PolicyEvaluator policy,
                               EventsConfig config, Clock clock) {
        this.tasks = tasks;
        this.ledger = ledger;
        this.policy = policy;
        this.config = config;
        this.clock = clock;
    }

    public PipelineResult trigger(String source, boolean deliver) {
        String src = source == null || source.isBlank() ? DEFAULT_SOURCE : source.trim();
        String auditId = "internal-" + UUID.randomUUID();
        ledger.upsertReceipt(new NewReceipt(auditId, EVENT_NAME, null, clock.instant().toString(),
            "trigger", null, null, ReceiptStatus.PROCESSING, null));

        try {
            ZoneId zone = ReminderNotifyRule.zone(config.getReminderTimezone());
            List<TaskContext> focusTasks = tasks.listAllActiveTasks().stream()
                .map(t -> ReminderNotifyRule.taskContext(t, t.id(), zone))
                .filter(TaskContext::hasFocusLabel)
                .toList();
            var policyConfig = new PolicyInput.PolicyConfig(config.isReminderRequireFocusLabel(),
                config.getAllowedHourStart(), config.getAllowedHourEnd());
            PolicyDecision decision = policy.evaluate(
                new PolicyInput(src, ZonedDateTime.now(clock.withZone(zone)), focusTasks, null, policyConfig));

            Map<String, Object> delivery = deliver(auditId, src, decision, focusTasks, deliver);

            var summary = new LinkedHashMap<String, Object>();
            summary.put("source", src);
            summary.put("focus_candidates", focusTasks.size());
            summary.put("decision", decisionView(decision));
            summary.put("delivery", delivery);
            ledger.markStatus(auditId, ReceiptStatus.PROCESSED, summary, null);
            LOG.info("Internal trigger {} source={} mode={} sent={}", auditId, src, decision.mode(), delivery.get("sent"));

            var body = new LinkedHashMap<String, Object>();
            body.put("ok", true);
            body.put("audit_id", auditId);
            body.put("source", src);
            body.put("decision", decisionView(decision));
            body.put("delivery", delivery);
            return new PipelineResult(200, body);
        } catch (TransientException e) {
            LOG.error("Internal trigger {} failed", auditId, e);
            ledger.markStatus(auditId, ReceiptStatus.ERROR, Map.of("source", src), String.valueOf(e.getMessage()));
            var body = new LinkedHashMap<String, Object>();
            body.put("ok", false);
            body.put("audit_id", auditId);
            body.put("error", "transient_processing_failure");
            return new PipelineResult(500, body);
        }
    }

    private Map<String, Object> deliver(String auditId, String source, PolicyDecision decision,
                                        List<TaskContext> focusTasks, boolean requested) {
        var delivery = new LinkedHashMap<String, Object>();
        delivery.put("requested", requested);
        delivery.put("sent", false);
        String url = config.getReminderWebhookUrl();
        if (!requested) {
            delivery.put("reason", "not_requested");
            return delivery;
        }
        if (!decision.shouldNotify()) {
            delivery.put("reason", "policy_skip");
            return delivery;
        }
        if (isBlank(url)) {
            delivery.put("reason", "missing_webhook_url");
            return delivery;
        }
        if (isBlank(config.getReminderWebhookToken())) {
            delivery.put("reason", "missing_webhook_token");
            return delivery;
        }

        var hookMeta = new LinkedHashMap<String, Object>();
        hookMeta.put("source", source);
        hookMeta.put("audit_id", auditId);
        hookMeta.put("policy_mode", decision.mode());
        hookMeta.put("policy_reason", decision.reason());
        hookMeta.put("focus_task_id", decision.focusTaskId());
        Map<String, Object> payload = ReminderMessages.hookPayload(
            ReminderMessages.triggerMessage(decision, focusTasks),
            config.getReminderTo(),
            isBlank(config.getReminderChannel()) ? "discord" : config.getReminderChannel(),
            HOOK_NAME);
        payload.put("meta", hookMeta);

        var actionMeta = new LinkedHashMap<String, Object>();
        actionMeta.put("source", source);
        actionMeta.put("policy_mode", decision.mode());
        if (config.isDryRun()) {
            actionMeta.put("reason", "dry_run");
            ledger.recordAction(auditId, RULE_NAME, ActionType.NOTIFY_WEBHOOK.wire(), "webhook", url,
                ActionResult.SKIPPED, actionMeta);
            delivery.put("reason", "dry_run");
            return delivery;
        }

        int status = tasks.postWebhook(url, payload, config.getReminderWebhookToken());
        boolean sent = status >= 200 && status < 300;
        actionMeta.put("webhook_status", status);
        ledger.recordAction(auditId, RULE_NAME, ActionType.NOTIFY_WEBHOOK.wire(), "webhook", url,
            sent ? ActionResult.SUCCESS : ActionResult.FAILED, actionMeta);
        delivery.put("sent", sent);
        delivery.put("webhook_status", status);
        return delivery;
    }

    static Map<String, Object> decisionView(PolicyDecision d) {
        var m = new LinkedHashMap<String, Object>();
        m.put("should_notify", d.shouldNotify());
        m.put("mode", d.mode());
        m.put("reason", d.reason());
        m.put("focus_task_id", d.focusTaskId());
        m.put("candidate_task_ids", d.candidateTaskIds());
        return m;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
