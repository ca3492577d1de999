package com.autotax.service;

import com.autotax.config.AutotaxConfig;
import com.autotax.domain.enums.LocalRateSource;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.engine.TaxCalculationEngine;
import com.autotax.engine.interpreter.RateComponentAggregator;
import com.autotax.exception.BusinessException;
import com.autotax.exception.ErrorCode;
import com.autotax.exception.ResourceNotFoundException;
import com.autotax.localtax.LocalTaxRateService;
import com.autotax.observability.TaxMetricsService;
import com.autotax.rules.TaxRulesRegistry;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Calling layer around the calculation engine: resolves the jurisdiction's rules,
 * fills in rate components from the local rate table when the deal carries none,
 * runs the engine and records metrics.
 *
 * <p>Missing jurisdictions surface here as exceptions; the engine itself never sees them.
 */
@Service
public class TaxCalculationService {

    private static final Logger log = LoggerFactory.getLogger(TaxCalculationService.class);

    private final TaxRulesRegistry taxRulesRegistry;
    private final LocalTaxRateService localTaxRateService;
    private final TaxCalculationEngine taxCalculationEngine;
    private final TaxMetricsService taxMetricsService;
    private final AutotaxConfig autotaxConfig;

    public TaxCalculationService(
            TaxRulesRegistry taxRulesRegistry,
            LocalTaxRateService localTaxRateService,
            TaxCalculationEngine taxCalculationEngine,
            TaxMetricsService taxMetricsService,
            AutotaxConfig autotaxConfig) {
        this.taxRulesRegistry = taxRulesRegistry;
        this.localTaxRateService = localTaxRateService;
        this.taxCalculationEngine = taxCalculationEngine;
        this.taxMetricsService = taxMetricsService;
        this.autotaxConfig = autotaxConfig;
    }

    /**
     * @param stateCode jurisdiction code (case-insensitive, {@code US_} prefix allowed)
     * @param zipCode   optional; used only when {@code deal.rates} is empty
     * @throws ResourceNotFoundException when no rules exist for the state
     * @throws BusinessException         when the state is a stub and stubs are rejected
     */
    public TaxCalculationResult calculate(String stateCode, String zipCode, TaxCalculationInput deal) {
        TaxRulesConfig rules = getRules(stateCode);
        if (rules.isStub()) {
            if (autotaxConfig.getCalculation().isRejectStubStates()) {
                throw new BusinessException(
                        ErrorCode.STATE_NOT_IMPLEMENTED,
                        "Tax rules for " + rules.getStateCode() + " are not implemented yet",
                        Map.of("stateCode", rules.getStateCode()));
            }
            log.warn("Calculating with stub tax rules for {}", rules.getStateCode());
        }

        TaxCalculationInput input = withResolvedRates(deal, zipCode, rules);
        if (input.getRates() == null || input.getRates().isEmpty()) {
            log.warn("No rate components for {} deal in {}; tax will be zero", input.getDealType(),
                    rules.getStateCode());
        }

        long start = System.nanoTime();
        TaxCalculationResult result = taxCalculationEngine.calculateTax(input, rules);
        boolean degraded = result.getDebug().isDegraded();
        taxMetricsService.recordCalculation(result.getMode(), System.nanoTime() - start, degraded);
        if (degraded) {
            log.warn("Calculation for {} fell back on incomplete rules: {}", rules.getStateCode(),
                    result.getDebug().getNotes());
        }
        return result;
    }

    public TaxRulesConfig getRules(String stateCode) {
        return taxRulesRegistry
                .getRulesForState(stateCode)
                .orElseThrow(() -> ResourceNotFoundException.taxRules(stateCode));
    }

    /** Rate components for a location, honoring whether the state's vehicle tax includes local rates. */
    public List<TaxRateComponent> resolveRates(LocalTaxRateInfo info, TaxRulesConfig rules) {
        List<TaxRateComponent> rates = RateComponentAggregator.fromLocalInfo(info);
        if (rules != null && !rules.isVehicleUsesLocalSalesTax()) {
            return rates.stream().filter(TaxRateComponent::isState).collect(Collectors.toList());
        }
        return rates;
    }

    private TaxCalculationInput withResolvedRates(TaxCalculationInput deal, String zipCode, TaxRulesConfig rules) {
        boolean hasRates = deal.getRates() != null && !deal.getRates().isEmpty();
        if (hasRates || zipCode == null || zipCode.isBlank()) {
            return deal;
        }
        LocalTaxRateInfo info = localTaxRateService.lookup(zipCode, rules.getStateCode());
        if (info.getSource() != LocalRateSource.ZIP_EXACT) {
            log.warn("ZIP {} not in local rate table; using {} rates for {}", zipCode, info.getSource(),
                    rules.getStateCode());
        }
        return deal.toBuilder().rates(resolveRates(info, rules)).build();
    }
}
