package com.autotax.domain.model;

import com.autotax.domain.enums.RebateAppliesTo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Whether a rebate funded by the given party is taxable. A taxable rebate stays in
 * the base; a non-taxable one reduces it.
 */
@Value
@Builder
@Jacksonized
public class RebateRule {

    RebateAppliesTo appliesTo;
    boolean taxable;
    String notes;

    public static RebateRule of(RebateAppliesTo appliesTo, boolean taxable) {
        return RebateRule.builder().appliesTo(appliesTo).taxable(taxable).build();
    }
}
