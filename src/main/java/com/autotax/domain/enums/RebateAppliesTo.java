package com.autotax.domain.enums;

/**
 * Which rebate party a rebate rule targets. ANY is a wildcard that is only consulted
 * when no rule names the party exactly.
 */
public enum RebateAppliesTo {
    MANUFACTURER,
    DEALER,
    ANY;

    public boolean matches(RebateParty party) {
        return this == ANY || name().equals(party.name());
    }
}
