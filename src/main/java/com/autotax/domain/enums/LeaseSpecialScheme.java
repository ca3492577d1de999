package com.autotax.domain.enums;

/**
 * Jurisdiction-specific lease quirks. Only NJ_LUXURY carries a numeric effect;
 * the rest are markers whose effect is already encoded in the rate components.
 */
public enum LeaseSpecialScheme {
    NONE,
    NY_MTR,
    NJ_LUXURY,
    PA_LEASE_TAX,
    IL_CHICAGO_COOK,
    TX_LEASE_SPECIAL,
    VA_USAGE,
    MD_UPFRONT_GAIN,
    CO_HOME_RULE_LEASE,
    GA_TAVT
}
