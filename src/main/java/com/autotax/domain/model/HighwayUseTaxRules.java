package com.autotax.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Highway use tax (North Carolina style): a state-only tax on the net price plus doc fee,
 * taxable fees and products. Manufacturer rebates reduce the base; dealer rebates do not.
 */
@Value
@Builder
@Jacksonized
public class HighwayUseTaxRules {

    BigDecimal rate;
    boolean includeTradeInReduction;

    /** Credit for tax paid elsewhere only within this many days; null means no window. */
    Integer maxReciprocityAgeDays;
}
