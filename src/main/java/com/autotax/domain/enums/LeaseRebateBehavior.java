package com.autotax.domain.enums;

/** Rebate treatment on lease deals. */
public enum LeaseRebateBehavior {
    FOLLOW_RETAIL_RULE,
    ALWAYS_TAXABLE,
    ALWAYS_NON_TAXABLE
}
