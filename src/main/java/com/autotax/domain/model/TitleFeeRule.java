package com.autotax.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Lease treatment of a government title/registration fee. */
@Value
@Builder
@Jacksonized
public class TitleFeeRule {

    String code;
    boolean taxable;
    boolean includedInCapCost;

    @Builder.Default
    boolean includedInUpfront = true;

    boolean includedInMonthly;
}
