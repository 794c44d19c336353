package com.guardrails.engine.policy;

import java.util.List;

/**
 * Supplies policy documents in declared order.
 */
public interface PolicySource {

    List<PolicyDocument> read();

    /**
     * Human-readable location for logs and reports.
     */
    String describe();
}
