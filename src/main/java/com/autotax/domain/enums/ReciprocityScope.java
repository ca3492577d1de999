package com.autotax.domain.enums;

/** Deal types a reciprocity credit applies to. */
public enum ReciprocityScope {
    RETAIL,
    LEASE,
    BOTH;

    /** An unknown (null) deal type is taxed as RETAIL and scoped the same way. */
    public boolean covers(DealType dealType) {
        DealType effective = dealType != null ? dealType : DealType.RETAIL;
        return this == BOTH || name().equals(effective.name());
    }
}
