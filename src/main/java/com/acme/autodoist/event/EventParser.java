package com.acme.autodoist.event;

import com.acme.autodoist.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public final class EventParser {

    private EventParser() {
    }

    /**
     * Maps a decoded webhook envelope onto {@link TodoistWebhookEvent}. Never fails on missing
     * fields; an absent event name yields an empty string which callers reject.
     */
    public static TodoistWebhookEvent parse(JsonNode payload, String deliveryId) {
        JsonNode root = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        String eventName = firstNonBlank(Jsons.text(root, "event_name"), Jsons.text(root, "eventName"));
        JsonNode data = object(root, "event_data");
        JsonNode extra = object(root, "event_data_extra");

        boolean reminder = TodoistWebhookEvent.REMINDER_FIRED.equals(eventName);
        String taskId = reminder
            ? firstNonNull(Jsons.text(data, "item_id"), Jsons.text(data, "id"))
            : firstNonNull(Jsons.text(data, "id"), Jsons.text(data, "item_id"));

        return new TodoistWebhookEvent(
            deliveryId,
            eventName,
            Jsons.text(root, "user_id"),
            Jsons.text(root, "triggered_at"),
            taskId,
            Jsons.text(data, "project_id"),
            Jsons.text(extra, "update_intent"),
            reminder ? Jsons.text(data, "id") : null,
            root
        );
    }

    private static JsonNode object(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isObject() ? v : JsonNodeFactory.instance.objectNode();
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isEmpty()) {
            return a;
        }
        return b == null ? "" : b;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
