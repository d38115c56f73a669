package com.acme.autodoist.rule;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.spi.PolicyEvaluator;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.TaskClient;
import java.time.Clock;

/**
 * Collaborators handed to every rule invocation. Built once at startup.
 */
public record RuleContext(
    EventsConfig config,
    ReceiptLedger ledger,
    TaskClient tasks,
    PolicyEvaluator policy,
    Clock clock
) {}
