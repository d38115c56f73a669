package com.acme.autodoist.rule;

import com.acme.autodoist.event.TodoistWebhookEvent;

public interface Rule {
    String name();

    /**
     * Side-effect free check over the event alone.
     */
    boolean matches(TodoistWebhookEvent event);

    /**
     * Decides the actions for a matching event. May read through the task client but never
     * performs a side effect.
     */
    RulePlan plan(RuleContext ctx, TodoistWebhookEvent event);
}
