package com.autotax.domain.model;

import com.autotax.domain.enums.LeaseDocFeeTaxability;
import com.autotax.domain.enums.LeaseMethod;
import com.autotax.domain.enums.LeaseRebateBehavior;
import com.autotax.domain.enums.LeaseSpecialScheme;
import com.autotax.domain.enums.LeaseTradeInCredit;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Lease-specific policy of a jurisdiction.
 *
 * <p>{@code taxCapReduction}: cash and taxable rebates applied as cap cost reduction are
 * taxed at signing. {@code taxFeesUpfront}: taxable fees are taxed at signing under the
 * MONTHLY method; otherwise they are assumed capitalized into the payment.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LeaseRules {

    LeaseMethod method;
    boolean taxCapReduction;
    LeaseRebateBehavior rebateBehavior;
    LeaseDocFeeTaxability docFeeTaxability;
    LeaseTradeInCredit tradeInCredit;
    boolean negativeEquityTaxable;

    @Builder.Default
    List<FeeTaxRule> feeTaxRules = List.of();

    @Builder.Default
    List<TitleFeeRule> titleFeeRules = List.of();

    @Builder.Default
    boolean taxFeesUpfront = true;

    @Builder.Default
    LeaseSpecialScheme specialScheme = LeaseSpecialScheme.NONE;

    String notes;
}
