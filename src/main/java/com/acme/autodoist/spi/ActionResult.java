package com.acme.autodoist.spi;

public enum ActionResult {
    SUCCESS("success"),
    SKIPPED("skipped"),
    FAILED("failed");

    private final String wire;

    ActionResult(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
