package com.acme.autodoist.spi;

import com.acme.autodoist.rule.PolicyDecision;
import com.acme.autodoist.rule.PolicyInput;

/**
 * Decides whether, and in which mode, a task should trigger a focus notification.
 */
public interface PolicyEvaluator {
    PolicyDecision evaluate(PolicyInput input);
}
