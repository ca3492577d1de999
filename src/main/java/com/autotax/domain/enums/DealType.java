package com.autotax.domain.enums;

/** Kind of vehicle transaction being taxed. */
public enum DealType {
    RETAIL,
    LEASE
}
