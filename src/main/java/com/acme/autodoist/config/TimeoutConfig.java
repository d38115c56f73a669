package com.acme.autodoist.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Configuration for ledger wait bounds.
 */
@ConfigurationProperties("timeout")
public class TimeoutConfig {

    private Duration ledgerQuery = Duration.ofSeconds(5);

    public Duration getLedgerQuery() {
        return ledgerQuery;
    }

    public void setLedgerQuery(Duration ledgerQuery) {
        this.ledgerQuery = ledgerQuery;
    }

    /**
     * JDBC query timeouts are whole seconds, so partial seconds round up.
     */
    public int getLedgerQuerySeconds() {
        return (int) Math.max(1, (ledgerQuery.toMillis() + 999) / 1000);
    }
}
