package com.autotax.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named slice of the combined tax rate, e.g. {@code STATE 0.06} or
 * {@code DISTRICT_RTD 0.01}. Rates are decimal fractions, not percentages.
 */
@Value
@Builder
@Jacksonized
public class TaxRateComponent {

    public static final String STATE = "STATE";
    public static final String COUNTY = "COUNTY";
    public static final String CITY = "CITY";
    public static final String SPECIAL_DISTRICT = "SPECIAL_DISTRICT";

    String label;
    BigDecimal rate;

    public static TaxRateComponent of(String label, BigDecimal rate) {
        return TaxRateComponent.builder().label(label).rate(rate).build();
    }

    @JsonIgnore
    public boolean isState() {
        return STATE.equals(label);
    }
}
