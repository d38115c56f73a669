package com.acme.autodoist.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized view of one webhook delivery. For {@code reminder:fired} the task id is the
 * reminder's item and {@code reminderId} is the reminder itself.
 */
public record TodoistWebhookEvent(
    String deliveryId,
    String eventName,
    String userId,
    String triggeredAt,
    String taskId,
    String projectId,
    String updateIntent,
    String reminderId,
    JsonNode raw
) {
    public static final String ITEM_COMPLETED = "item:completed";
    public static final String ITEM_UPDATED = "item:updated";
    public static final String REMINDER_FIRED = "reminder:fired";
    public static final String INTENT_ITEM_COMPLETED = "item_completed";

    public boolean isCompletion() {
        if (ITEM_COMPLETED.equals(eventName)) {
            return true;
        }
        return ITEM_UPDATED.equals(eventName) && INTENT_ITEM_COMPLETED.equals(updateIntent);
    }

    public boolean hasTask() {
        return taskId != null;
    }
}
