package com.age.mcp.metrics;

/**
 * How a scoped transaction ended.
 */
public enum TransactionOutcome {
    COMMITTED,
    ROLLED_BACK
}
