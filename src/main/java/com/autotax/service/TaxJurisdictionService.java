package com.autotax.service;

import com.autotax.api.dto.response.LocalRateResponse;
import com.autotax.api.dto.response.StateListResponse;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.localtax.LocalTaxRateService;
import com.autotax.rules.TaxRulesRegistry;
import org.springframework.stereotype.Service;

/** Read-only queries over the loaded jurisdiction data. */
@Service
public class TaxJurisdictionService {

    private final TaxRulesRegistry taxRulesRegistry;
    private final LocalTaxRateService localTaxRateService;
    private final TaxCalculationService taxCalculationService;

    public TaxJurisdictionService(
            TaxRulesRegistry taxRulesRegistry,
            LocalTaxRateService localTaxRateService,
            TaxCalculationService taxCalculationService) {
        this.taxRulesRegistry = taxRulesRegistry;
        this.localTaxRateService = localTaxRateService;
        this.taxCalculationService = taxCalculationService;
    }

    public StateListResponse listStates() {
        return StateListResponse.builder()
                .implementedStates(taxRulesRegistry.getImplementedStates())
                .stubStates(taxRulesRegistry.getStubStates())
                .build();
    }

    public TaxRulesConfig getRules(String stateCode) {
        return taxCalculationService.getRules(stateCode);
    }

    /**
     * Local rates for a ZIP. When the state also has rules, the returned components are
     * the ones a calculation for that state would use.
     */
    public LocalRateResponse lookupLocalRates(String zipCode, String stateCode) {
        LocalTaxRateInfo info = localTaxRateService.lookup(zipCode, stateCode);
        TaxRulesConfig rules = taxRulesRegistry.getRulesForState(info.getStateCode()).orElse(null);
        return LocalRateResponse.builder()
                .rateInfo(info)
                .combinedRate(info.getCombinedRate())
                .rateComponents(taxCalculationService.resolveRates(info, rules))
                .build();
    }
}
