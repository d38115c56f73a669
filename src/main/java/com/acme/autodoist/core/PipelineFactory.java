package com.acme.autodoist.core;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.rule.RuleContext;
import com.acme.autodoist.spi.PolicyEvaluator;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.TaskClient;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

@Factory
public class PipelineFactory {

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Singleton
    public RuleContext ruleContext(EventsConfig config, ReceiptLedger ledger, TaskClient tasks,
                                   PolicyEvaluator policy, Clock clock) {
        return new RuleContext(config, ledger, tasks, policy, clock);
    }
}
