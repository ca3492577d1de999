package com.autotax.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Split of lease tax between signing and the payment stream.
 * {@code totalTaxOverTerm = upfrontTaxes.totalTax + paymentTaxesPerPeriod.totalTax * paymentCount}.
 */
@Value
@Builder
public class LeaseTaxBreakdown {

    BigDecimal upfrontTaxableBase;
    TaxAmountBreakdown upfrontTaxes;
    BigDecimal paymentTaxableBasePerPeriod;
    TaxAmountBreakdown paymentTaxesPerPeriod;
    int paymentCount;
    BigDecimal totalTaxOverTerm;
}
