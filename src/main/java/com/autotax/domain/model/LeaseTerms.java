package com.autotax.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Lease-only figures of a deal. Cap reduction amounts are the portions of cash, trade-in
 * equity and rebates applied against the gross capitalized cost; when a cap reduction
 * amount is zero the engine falls back to the matching retail field on the input.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LeaseTerms {

    @Builder.Default
    BigDecimal grossCapCost = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal capReductionCash = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal capReductionTradeIn = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal capReductionRebateManufacturer = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal capReductionRebateDealer = BigDecimal.ZERO;

    /** Pre-tax periodic payment. */
    @Builder.Default
    BigDecimal basePayment = BigDecimal.ZERO;

    @Builder.Default
    int paymentCount = 0;
}
