package com.acme.autodoist.rule;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Task as seen by the focus policy: lower-cased labels and due values in the reminder timezone.
 */
public record TaskContext(
    String id,
    String content,
    Set<String> labels,
    String projectId,
    LocalDate dueDate,
    ZonedDateTime dueDateTimeLocal,
    String url
) {
    public static final String FOCUS_LABEL = "focus";

    public boolean hasFocusLabel() {
        return labels.contains(FOCUS_LABEL);
    }
}
