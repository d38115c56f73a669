package com.acme.autodoist.spi;

public enum ReceiptStatus {
    RECEIVED("received"),
    REJECTED_SIGNATURE("rejected_signature"),
    BAD_REQUEST("bad_request"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    ERROR("error"),
    IGNORED_DISABLED("ignored_disabled"),
    IGNORED_ALLOWLIST("ignored_allowlist");

    private final String wire;

    ReceiptStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static ReceiptStatus fromWire(String value) {
        for (ReceiptStatus s : values()) {
            if (s.wire.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown receipt status " + value);
    }
}
