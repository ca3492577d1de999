package com.autotax.domain.vo;

import com.autotax.domain.enums.DealType;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one calculation. For LEASE deals {@code taxes} holds the tax due at signing
 * and {@code leaseBreakdown} the full upfront/periodic split; it is null for RETAIL.
 */
@Value
@Builder
public class TaxCalculationResult {

    DealType mode;
    TaxBaseBreakdown bases;
    TaxAmountBreakdown taxes;
    LeaseTaxBreakdown leaseBreakdown;
    TaxDebug debug;
}
