package com.autotax.api.controller;

import com.autotax.api.dto.response.LocalRateResponse;
import com.autotax.api.dto.response.StateListResponse;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.service.TaxJurisdictionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for jurisdiction reference data.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/tax/states} -- implemented and stub state codes</li>
 *   <li>{@code GET /api/tax/states/{code}} -- the rules of one state</li>
 *   <li>{@code GET /api/tax/local/{zipCode}?stateCode=XX} -- local rates for a ZIP</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/tax")
public class TaxJurisdictionController {

    private final TaxJurisdictionService taxJurisdictionService;

    public TaxJurisdictionController(TaxJurisdictionService taxJurisdictionService) {
        this.taxJurisdictionService = taxJurisdictionService;
    }

    @GetMapping("/states")
    public StateListResponse listStates() {
        return taxJurisdictionService.listStates();
    }

    @GetMapping("/states/{code}")
    public TaxRulesConfig getRules(@PathVariable String code) {
        return taxJurisdictionService.getRules(code);
    }

    @GetMapping("/local/{zipCode}")
    public LocalRateResponse lookupLocalRates(
            @PathVariable String zipCode, @RequestParam(required = false) String stateCode) {
        return taxJurisdictionService.lookupLocalRates(zipCode, stateCode);
    }
}
