package com.autotax.domain.enums;

/** What amount a reciprocity credit is measured against. */
public enum ReciprocityBasis {
    TAX_PAID
}
