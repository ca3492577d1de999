package com.autotax.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Fixed dollar ceiling on the tax of one deal (e.g. South Carolina's $500 IMF). */
@Value
@Builder
@Jacksonized
public class TaxCap {

    BigDecimal maxTaxAmount;
    String notes;

    public static TaxCap of(BigDecimal maxTaxAmount) {
        return TaxCap.builder().maxTaxAmount(maxTaxAmount).build();
    }
}
