package com.autotax.domain.model;

import com.autotax.domain.enums.LocalRateSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Flat local rate summary for one ZIP code, as produced by the local rate lookup. */
@Value
@Builder
public class LocalTaxRateInfo {

    String zipCode;
    String stateCode;
    String city;
    String county;
    BigDecimal stateTaxRate;
    BigDecimal countyRate;
    BigDecimal cityRate;
    BigDecimal specialDistrictRate;
    LocalRateSource source;

    public BigDecimal getCombinedRate() {
        return stateTaxRate.add(countyRate).add(cityRate).add(specialDistrictRate);
    }
}
