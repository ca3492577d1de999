package com.autotax.api.controller;

import com.autotax.api.dto.request.TaxCalculationRequest;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.service.TaxCalculationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for vehicle tax calculations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/tax/calculate} -- calculate tax for one deal in one state</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/tax")
public class TaxCalculationController {

    private final TaxCalculationService taxCalculationService;

    public TaxCalculationController(TaxCalculationService taxCalculationService) {
        this.taxCalculationService = taxCalculationService;
    }

    @PostMapping("/calculate")
    public TaxCalculationResult calculate(@RequestBody @Valid TaxCalculationRequest request) {
        return taxCalculationService.calculate(request.getStateCode(), request.getZipCode(), request.getDeal());
    }
}
