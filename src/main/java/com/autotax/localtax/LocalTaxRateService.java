package com.autotax.localtax;

import com.autotax.domain.enums.LocalRateSource;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.engine.Amounts;
import com.autotax.exception.BusinessException;
import com.autotax.exception.ErrorCode;
import com.autotax.exception.ResourceNotFoundException;
import com.autotax.localtax.LocalTaxRateTable.StateRates;
import com.autotax.localtax.LocalTaxRateTable.ZipRates;
import com.autotax.rules.TaxRulesRegistry;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZIP-code to local rate lookup.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@link LocalRateSource#ZIP_EXACT}: the ZIP is in the table for the requested state</li>
 *   <li>{@link LocalRateSource#STATE_AVERAGE}: the state levies local tax; its average local
 *       rate is reported in the county slot</li>
 *   <li>{@link LocalRateSource#STATE_ONLY}: the state has no local vehicle tax; local rates are 0</li>
 * </ol>
 * The table is read once at startup and never modified.
 */
public class LocalTaxRateService {

    private static final Logger log = LoggerFactory.getLogger(LocalTaxRateService.class);

    private static final Pattern ZIP_PATTERN = Pattern.compile("\\d{5}(-\\d{4})?");

    private final Map<String, StateRates> states;
    private final Map<String, ZipRates> zipCodes;

    public LocalTaxRateService(LocalTaxRateTable table) {
        Map<String, StateRates> byState = new HashMap<>();
        table.getStates().forEach((code, rates) -> byState.put(TaxRulesRegistry.normalize(code), rates));
        this.states = Map.copyOf(byState);
        this.zipCodes = Map.copyOf(table.getZipCodes());
        log.info("Local tax rate table ready: {} states, {} ZIP codes", states.size(), zipCodes.size());
    }

    /**
     * @param zipCode   five-digit or ZIP+4 code
     * @param stateCode state of the deal; when null the ZIP entry's state is used
     * @throws BusinessException         for a malformed ZIP code
     * @throws ResourceNotFoundException when the state has no rate data
     */
    public LocalTaxRateInfo lookup(String zipCode, String stateCode) {
        String zip5 = toZip5(zipCode);
        ZipRates zipRates = zipCodes.get(zip5);
        String state = stateCode != null ? TaxRulesRegistry.normalize(stateCode) : null;
        if (state == null && zipRates != null) {
            state = TaxRulesRegistry.normalize(zipRates.getStateCode());
        }
        if (state == null) {
            throw ResourceNotFoundException.zipWithoutState(zipCode);
        }
        StateRates stateRates = states.get(state);
        if (stateRates == null) {
            throw ResourceNotFoundException.stateRates(state);
        }
        BigDecimal stateRate = Amounts.orZero(stateRates.getStateTaxRate());

        if (zipRates != null && state.equals(TaxRulesRegistry.normalize(zipRates.getStateCode()))) {
            return LocalTaxRateInfo.builder()
                    .zipCode(zip5)
                    .stateCode(state)
                    .city(zipRates.getCity())
                    .county(zipRates.getCounty())
                    .stateTaxRate(stateRate)
                    .countyRate(Amounts.orZero(zipRates.getCountyRate()))
                    .cityRate(Amounts.orZero(zipRates.getCityRate()))
                    .specialDistrictRate(Amounts.orZero(zipRates.getSpecialDistrictRate()))
                    .source(LocalRateSource.ZIP_EXACT)
                    .build();
        }
        if (zipRates != null) {
            log.warn("ZIP {} belongs to {}, not {}; using {} state-level rates", zip5, zipRates.getStateCode(), state,
                    state);
        }

        boolean hasLocalTax = stateRates.isHasLocalTax();
        return LocalTaxRateInfo.builder()
                .zipCode(zip5)
                .stateCode(state)
                .stateTaxRate(stateRate)
                .countyRate(hasLocalTax ? Amounts.orZero(stateRates.getAverageLocalRate()) : BigDecimal.ZERO)
                .cityRate(BigDecimal.ZERO)
                .specialDistrictRate(BigDecimal.ZERO)
                .source(hasLocalTax ? LocalRateSource.STATE_AVERAGE : LocalRateSource.STATE_ONLY)
                .build();
    }

    public boolean hasStateData(String stateCode) {
        String state = TaxRulesRegistry.normalize(stateCode);
        return state != null && states.containsKey(state);
    }

    static String toZip5(String zipCode) {
        String zip = zipCode != null ? zipCode.trim() : "";
        if (!ZIP_PATTERN.matcher(zip).matches()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Invalid ZIP code: " + zipCode,
                    Map.of("zipCode", "must be 12345 or 12345-6789"));
        }
        return zip.substring(0, 5);
    }
}
