package com.acme.autodoist.web;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.ReceiptLedger.Outcome;
import com.acme.autodoist.spi.ReceiptLedger.Receipt;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.QueryValue;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the delivery ledger, guarded by the admin bearer token.
 */
@Controller("/api/events")
public class AdminController {
    static final int MAX_LIMIT = 1000;

    private final ReceiptLedger ledger;
    private final EventsConfig config;

    public AdminController(ReceiptLedger ledger, EventsConfig config) {
        this.ledger = ledger;
        this.config = config;
    }

    @Get(produces = MediaType.APPLICATION_JSON)
    public HttpResponse<String> list(
            @Header(value = HttpHeaders.AUTHORIZATION, defaultValue = "") String authorization,
            @QueryValue(defaultValue = "200") int limit) {
        if (!isAdmin(authorization)) {
            return unauthorized();
        }
        int bounded = Math.max(1, Math.min(MAX_LIMIT, limit));
        return WebhookController.json(200, Map.of("ok", true,
            "items", ledger.listReceipts(bounded).stream().map(AdminController::receiptView).toList()));
    }

    @Get(value = "/{deliveryId}", produces = MediaType.APPLICATION_JSON)
    public HttpResponse<String> get(
            @Header(value = HttpHeaders.AUTHORIZATION, defaultValue = "") String authorization,
            @PathVariable String deliveryId) {
        if (!isAdmin(authorization)) {
            return unauthorized();
        }
        return ledger.getReceipt(deliveryId)
            .map(receipt -> {
                var body = new LinkedHashMap<String, Object>();
                body.put("ok", true);
                body.put("receipt", receiptView(receipt));
                body.put("actions", ledger.listActions(deliveryId).stream().map(AdminController::outcomeView).toList());
                return WebhookController.json(200, body);
            })
            .orElseGet(() -> WebhookController.json(404, Map.of("ok", false, "error", "not_found")));
    }

    private boolean isAdmin(@Nullable String authorization) {
        String token = config.getAdminToken();
        if (token == null || token.isBlank() || authorization == null || authorization.isBlank()) {
            return false;
        }
        byte[] expected = ("Bearer " + token).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, authorization.trim().getBytes(StandardCharsets.UTF_8));
    }

    static Map<String, Object> receiptView(Receipt r) {
        var m = new LinkedHashMap<String, Object>();
        m.put("delivery_id", r.deliveryId());
        m.put("received_at", r.receivedAt() == null ? null : r.receivedAt().toString());
        m.put("event_name", r.eventName());
        m.put("user_id", r.userId());
        m.put("triggered_at", r.triggeredAt());
        m.put("entity_type", r.entityType());
        m.put("entity_id", r.entityId());
        m.put("project_id", r.projectId());
        m.put("status", r.status() == null ? null : r.status().wire());
        m.put("attempt_count", r.attemptCount());
        m.put("last_error", r.lastError());
        m.put("summary", r.summary());
        m.put("payload_hash", r.payloadHash());
        return m;
    }

    static Map<String, Object> outcomeView(Outcome o) {
        var m = new LinkedHashMap<String, Object>();
        m.put("id", o.id());
        m.put("rule_name", o.ruleName());
        m.put("action_type", o.actionType());
        m.put("target_type", o.targetType());
        m.put("target_id", o.targetId());
        m.put("result", o.result());
        m.put("meta", o.meta());
        return m;
    }

    private static HttpResponse<String> unauthorized() {
        return WebhookController.json(401, Map.of("ok", false, "error", "unauthorized"));
    }
}
