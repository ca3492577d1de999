package com.autotax.domain.model;

import com.autotax.domain.enums.VehicleClass;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * DMV privilege tax (West Virginia style). Both rebate parties stay in the base; the rate
 * may vary by vehicle class.
 */
@Value
@Builder
@Jacksonized
public class PrivilegeTaxRules {

    /** Rate for classes without an entry in {@code vehicleClassRates}. */
    BigDecimal rate;

    boolean useHigherOfPriceOrAssessed;
    boolean allowTradeInCredit;
    boolean applyNegativeEquityToBase;

    @Builder.Default
    Map<VehicleClass, BigDecimal> vehicleClassRates = Map.of();
}
