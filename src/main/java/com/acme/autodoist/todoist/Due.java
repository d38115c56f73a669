package com.acme.autodoist.todoist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Due(
    String date,
    String datetime,
    String string,
    String timezone,
    @JsonProperty("is_recurring") boolean isRecurring
) {}
