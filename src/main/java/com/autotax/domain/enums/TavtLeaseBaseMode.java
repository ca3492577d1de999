package com.autotax.domain.enums;

/** What a title ad valorem tax measures on a lease. */
public enum TavtLeaseBaseMode {

    /** Gross capitalized cost, falling back to the vehicle price. */
    CAP_COST,

    /** The agreed value of the vehicle (the deal's vehicle price). */
    AGREED_VALUE
}
