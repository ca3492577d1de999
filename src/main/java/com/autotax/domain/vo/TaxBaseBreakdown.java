package com.autotax.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** Taxable bases of a deal. {@code totalTaxableBase} is always the sum of the other three. */
@Value
public class TaxBaseBreakdown {

    BigDecimal vehicleBase;
    BigDecimal feesBase;
    BigDecimal productsBase;
    BigDecimal totalTaxableBase;

    public static TaxBaseBreakdown of(BigDecimal vehicleBase, BigDecimal feesBase, BigDecimal productsBase) {
        return new TaxBaseBreakdown(
                vehicleBase, feesBase, productsBase, vehicleBase.add(feesBase).add(productsBase));
    }
}
