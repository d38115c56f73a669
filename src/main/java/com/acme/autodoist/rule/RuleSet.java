package com.acme.autodoist.rule;

import java.util.List;

public final class RuleSet {

    private RuleSet() {
    }

    /**
     * Every rule the worker knows, in evaluation order. Each can be switched off through config.
     */
    public static List<Rule> defaults() {
        return List.of(
            new RecurringClearCommentsRule(),
            new RecurringPurgeSubtasksRule(),
            new ReminderNotifyRule()
        );
    }
}
