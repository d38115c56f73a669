package com.acme.autodoist.rule;

import java.time.ZonedDateTime;
import java.util.List;

public record PolicyInput(
    String source,
    ZonedDateTime nowLocal,
    List<TaskContext> focusTasks,
    TaskContext reminderTask,
    PolicyConfig config
) {
    public static final String SOURCE_REMINDER = "reminder";

    /**
     * @param allowedHourEnd exclusive; 24 leaves the window open all day
     */
    public record PolicyConfig(boolean requireFocusForReminder, int allowedHourStart, int allowedHourEnd) {}
}
