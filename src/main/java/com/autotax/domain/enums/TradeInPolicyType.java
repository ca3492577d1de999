package com.autotax.domain.enums;

/**
 * How a jurisdiction credits the value of a trade-in vehicle against the taxable price.
 *
 * <p>CAPPED and PERCENT carry a parameter on {@link com.autotax.domain.model.TradeInPolicy}.
 */
public enum TradeInPolicyType {

    /** No trade-in credit at all; the full price is taxed. */
    NONE,

    /** The entire trade-in value reduces the taxable price. */
    FULL,

    /** Trade-in credit limited to a fixed dollar amount. */
    CAPPED,

    /** Only a fraction (0..1) of the trade-in value is credited. */
    PERCENT
}
