package com.autotax.domain.enums;

/** Doc fee treatment on lease deals. */
public enum LeaseDocFeeTaxability {
    ALWAYS,
    NEVER,
    FOLLOW_RETAIL_RULE,

    /** Taxed once at signing, never re-taxed in the payment stream. */
    ONLY_UPFRONT
}
