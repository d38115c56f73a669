package com.acme.autodoist.spi;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of webhook deliveries and the side effects performed for them.
 * Every write is idempotent on its key so sender redelivery is safe for bookkeeping.
 */
public interface ReceiptLedger {

    /**
     * Inserts the receipt on first sight, otherwise bumps {@code attempt_count} and takes the new status.
     * A receipt already {@code processed} stays {@code processed}.
     */
    UpsertResult upsertReceipt(NewReceipt receipt);

    void markStatus(String deliveryId, ReceiptStatus status, Map<String, Object> summary, String error);

    void recordAction(String deliveryId, String ruleName, String actionType, String targetType,
                      String targetId, ActionResult result, Map<String, Object> meta);

    Optional<Instant> lastReminderNotification(String taskId, String mode);

    void recordReminderNotification(String taskId, String mode, Instant sentAt);

    List<Receipt> listReceipts(int limit);

    Optional<Receipt> getReceipt(String deliveryId);

    List<Outcome> listActions(String deliveryId);

    default void markStatus(String deliveryId, ReceiptStatus status) {
        markStatus(deliveryId, status, Map.of(), null);
    }

    record NewReceipt(
        String deliveryId,
        String eventName,
        String userId,
        String triggeredAt,
        String entityType,
        String entityId,
        String projectId,
        ReceiptStatus status,
        String payloadHash
    ) {}

    record Receipt(
        String deliveryId,
        Instant receivedAt,
        String eventName,
        String userId,
        String triggeredAt,
        String entityType,
        String entityId,
        String projectId,
        ReceiptStatus status,
        int attemptCount,
        String lastError,
        Map<String, Object> summary,
        String payloadHash
    ) {}

    record UpsertResult(boolean isNew, Receipt receipt) {}

    record Outcome(
        long id,
        String deliveryId,
        String ruleName,
        String actionType,
        String targetType,
        String targetId,
        String result,
        Map<String, Object> meta
    ) {}
}
