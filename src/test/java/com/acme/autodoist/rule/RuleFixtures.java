package com.acme.autodoist.rule;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.todoist.Due;
import com.acme.autodoist.todoist.Task;
import java.util.List;

final class RuleFixtures {

    private RuleFixtures() {
    }

    static Task recurring(String id, String projectId) {
        return new Task(id, "Water plants", projectId, null, List.of(),
            new Due("2026-01-05", null, "every day", null, true), null);
    }

    static Task oneOff(String id, String projectId) {
        return new Task(id, "Buy milk", projectId, null, List.of(), new Due("2026-01-05", null, "jan 5", null, false), null);
    }

    static Task child(String id, String parentId) {
        return new Task(id, "sub " + id, "p1", parentId, List.of(), null, null);
    }

    static TodoistWebhookEvent completed(String taskId, String projectId) {
        return new TodoistWebhookEvent("d-1", TodoistWebhookEvent.ITEM_COMPLETED, "u1", null, taskId, projectId,
            null, null, null);
    }

    static TodoistWebhookEvent reminder(String taskId, String reminderId) {
        return new TodoistWebhookEvent("d-1", TodoistWebhookEvent.REMINDER_FIRED, "u1", "2026-01-05T15:00:00Z",
            taskId, "p1", null, reminderId, null);
    }

    static EventsConfig config() {
        EventsConfig config = new EventsConfig();
        config.setApiToken("token");
        config.setWebhookSecret("secret");
        return config;
    }
}
