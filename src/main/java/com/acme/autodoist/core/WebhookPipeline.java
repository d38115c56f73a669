package com.acme.autodoist.core;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.event.EventParser;
import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.rule.Action;
import com.acme.autodoist.rule.Rule;
import com.acme.autodoist.rule.RuleContext;
import com.acme.autodoist.rule.RulePlan;
import com.acme.autodoist.rule.RuleSet;
import com.acme.autodoist.spi.ActionResult;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.ReceiptLedger.NewReceipt;
import com.acme.autodoist.spi.ReceiptLedger.UpsertResult;
import com.acme.autodoist.spi.ReceiptStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verify, dedupe, gate, plan and execute one webhook delivery, keeping its receipt current
 * at every step. Runs synchronously on the calling request thread.
 */
@Singleton
public class WebhookPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookPipeline.class);
    private static final String UNKNOWN = "unknown";

    private final ReceiptLedger ledger;
    private final ActionExecutor executor;
    private final RuleContext ruleContext;
    private final EventsConfig config;
    private final List<Rule> rules;

    @Inject
    public WebhookPipeline(ReceiptLedger ledger, ActionExecutor executor, RuleContext ruleContext) {
        this(ledger, executor, ruleContext, RuleSet.defaults());
    }

    WebhookPipeline(ReceiptLedger ledger, ActionExecutor executor, RuleContext ruleContext, List<Rule> rules) {
        this.ledger = ledger;
        this.executor = executor;
        this.ruleContext = ruleContext;
        this.config = ruleContext.config();
        this.rules = List.copyOf(rules);
    }

    public PipelineResult process(WebhookDelivery delivery) {
        String deliveryId = delivery.deliveryId() == null ? "" : delivery.deliveryId().trim();
        if (deliveryId.isEmpty()) {
            return PipelineResult.failure(400, "missing_delivery_id", null);
        }
        byte[] body = delivery.body() == null ? new byte[0] : delivery.body();
        String payloadHash = SignatureVerifier.sha256Hex(body);

        if (!SignatureVerifier.verify(body, delivery.signature(), config.getWebhookSecret())) {
            LOG.warn("Rejected delivery {}: invalid signature", deliveryId);
            ledger.upsertReceipt(unidentified(deliveryId, ReceiptStatus.REJECTED_SIGNATURE, payloadHash));
            return PipelineResult.failure(401, "invalid_signature", null);
        }

        JsonNode payload;
        try {
            payload = Jsons.readTree(new String(body, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            LOG.warn("Rejected delivery {}: unparsable body ({})", deliveryId, e.getOriginalMessage());
            return badRequest(deliveryId, payloadHash);
        }
        if (payload == null || !payload.isObject()) {
            LOG.warn("Rejected delivery {}: body is not a JSON object", deliveryId);
            return badRequest(deliveryId, payloadHash);
        }

        TodoistWebhookEvent event = EventParser.parse(payload, deliveryId);
        if (event.eventName().isEmpty()) {
            return PipelineResult.failure(400, "missing_event_name", null);
        }

        UpsertResult upsert = ledger.upsertReceipt(new NewReceipt(
            deliveryId, event.eventName(), event.userId(), event.triggeredAt(),
            "task", event.taskId(), event.projectId(), ReceiptStatus.RECEIVED, payloadHash));
        if (!upsert.isNew() && upsert.receipt().status() == ReceiptStatus.PROCESSED) {
            LOG.info("Delivery {} already processed (attempt {}), skipping", deliveryId, upsert.receipt().attemptCount());
            return PipelineResult.ok(deliveryId, Map.of("duplicate", true));
        }

        Optional<Gate> gate = gate(event);
        if (gate.isPresent()) {
            Gate g = gate.get();
            ledger.markStatus(deliveryId, g.status(), g.summary(), null);
            LOG.info("Delivery {} {} ({})", deliveryId, g.status().wire(), g.summary());
            return PipelineResult.ok(deliveryId, Map.of("status", g.status().wire()));
        }

        try {
            ledger.markStatus(deliveryId, ReceiptStatus.PROCESSING);
            List<Map<String, Object>> outcomes = runRules(event);

            var summary = new LinkedHashMap<String, Object>();
            summary.put("rules_triggered", outcomes.size());
            if (!outcomes.isEmpty()) {
                summary.put("outcomes", outcomes);
            }
            ledger.markStatus(deliveryId, ReceiptStatus.PROCESSED, summary, null);
            LOG.info("Processed delivery {} event={} rules_triggered={}", deliveryId, event.eventName(), outcomes.size());

            var fields = new LinkedHashMap<String, Object>();
            fields.put("duplicate", false);
            fields.put("outcomes", outcomes);
            return PipelineResult.ok(deliveryId, fields);
        } catch (RuntimeException e) {
            LOG.error("Failed processing delivery_id={}", deliveryId, e);
            ledger.markStatus(deliveryId, ReceiptStatus.ERROR, Map.of(), String.valueOf(e.getMessage()));
            return PipelineResult.failure(500, "transient_processing_failure", deliveryId);
        }
    }

    private List<Map<String, Object>> runRules(TodoistWebhookEvent event) {
        List<Map<String, Object>> outcomes = new ArrayList<>();
        for (Rule rule : rules) {
            if (!config.isRuleEnabled(rule.name()) || !rule.matches(event)) {
                continue;
            }
            RulePlan plan = rule.plan(ruleContext, event);
            int executed = 0;
            for (Action action : plan.actions()) {
                if (executor.execute(event.deliveryId(), rule.name(), action) == ActionResult.SUCCESS) {
                    executed++;
                }
            }
            var outcome = new LinkedHashMap<String, Object>();
            outcome.put("rule", rule.name());
            outcome.putAll(plan.meta());
            outcome.put("executed", executed);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private Optional<Gate> gate(TodoistWebhookEvent event) {
        if (!config.isEnabled()) {
            return Optional.of(new Gate(ReceiptStatus.IGNORED_DISABLED, Map.of("enabled", false)));
        }
        if (!config.getAllowedUserIds().isEmpty()
            && (event.userId() == null || !config.getAllowedUserIds().contains(event.userId()))) {
            return Optional.of(new Gate(ReceiptStatus.IGNORED_ALLOWLIST, Map.of("reason", "user_id")));
        }
        if (event.projectId() != null && config.getDeniedProjectIds().contains(event.projectId())) {
            return Optional.of(new Gate(ReceiptStatus.IGNORED_ALLOWLIST, Map.of("reason", "denied_project")));
        }
        if (!config.getAllowedProjectIds().isEmpty()
            && (event.projectId() == null || !config.getAllowedProjectIds().contains(event.projectId()))) {
            return Optional.of(new Gate(ReceiptStatus.IGNORED_ALLOWLIST, Map.of("reason", "project_id")));
        }
        return Optional.empty();
    }

    private PipelineResult badRequest(String deliveryId, String payloadHash) {
        ledger.upsertReceipt(unidentified(deliveryId, ReceiptStatus.BAD_REQUEST, payloadHash));
        return PipelineResult.failure(400, "invalid_json", null);
    }

    private static NewReceipt unidentified(String deliveryId, ReceiptStatus status, String payloadHash) {
        return new NewReceipt(deliveryId, UNKNOWN, null, null, UNKNOWN, null, null, status, payloadHash);
    }

    private record Gate(ReceiptStatus status, Map<String, Object> summary) {}
}
