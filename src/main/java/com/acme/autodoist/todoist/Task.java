package com.acme.autodoist.todoist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(
    String id,
    String content,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("parent_id") String parentId,
    List<String> labels,
    Due due,
    String url
) {
    public Task {
        labels = labels == null ? List.of() : labels;
    }

    public boolean isRecurring() {
        return due != null && due.isRecurring();
    }

    /**
     * Parent id with blank values treated as absent.
     */
    public String parentIdOrNull() {
        if (parentId == null || parentId.isBlank()) {
            return null;
        }
        return parentId.trim();
    }
}
