package com.autotax.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Taxability of one fee code. Codes not listed are treated as non-taxable. */
@Value
@Builder
@Jacksonized
public class FeeTaxRule {

    String code;
    boolean taxable;
    String notes;

    public static FeeTaxRule of(String code, boolean taxable) {
        return FeeTaxRule.builder().code(code).taxable(taxable).build();
    }
}
