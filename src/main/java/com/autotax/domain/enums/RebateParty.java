package com.autotax.domain.enums;

/** Who funds a rebate on the deal. */
public enum RebateParty {
    MANUFACTURER,
    DEALER
}
