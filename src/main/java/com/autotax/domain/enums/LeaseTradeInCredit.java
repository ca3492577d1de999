package com.autotax.domain.enums;

/** Trade-in treatment on lease deals. */
public enum LeaseTradeInCredit {
    NONE,
    FULL,

    /** Reduces the capitalized cost the same way FULL does. */
    CAP_COST_ONLY,

    /** Equity goes toward the payment; the taxable lease base is unchanged. */
    APPLIED_TO_PAYMENT,

    /** Use the retail {@link TradeInPolicyType} of the jurisdiction. */
    FOLLOW_RETAIL_RULE
}
