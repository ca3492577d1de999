package com.autotax.localtax;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** JSON shape of the bundled local rate table: per-state summaries and per-ZIP overrides. */
@Value
@Builder
@Jacksonized
public class LocalTaxRateTable {

    @Builder.Default
    Map<String, StateRates> states = Map.of();

    /** Keyed by five-digit ZIP. */
    @Builder.Default
    Map<String, ZipRates> zipCodes = Map.of();

    @Value
    @Builder
    @Jacksonized
    public static class StateRates {
        BigDecimal stateTaxRate;
        /** Typical combined county + city + district rate, used when a ZIP is not in the table. */
        BigDecimal averageLocalRate;
        /** Whether local jurisdictions levy tax on vehicle sales at all. */
        boolean hasLocalTax;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ZipRates {
        String stateCode;
        String city;
        String county;
        BigDecimal countyRate;
        BigDecimal cityRate;
        BigDecimal specialDistrictRate;
    }
}
