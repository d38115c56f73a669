package com.acme.autodoist.rule;

public enum ActionType {
    DELETE_COMMENT("delete_comment"),
    DELETE_TASK("delete_task"),
    NOTIFY_WEBHOOK("notify_webhook");

    private final String wire;

    ActionType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
