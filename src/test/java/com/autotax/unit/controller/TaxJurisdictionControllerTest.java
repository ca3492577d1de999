package com.autotax.unit.controller;

import static com.autotax.fixtures.TaxRulesFixtures.retailRules;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.autotax.api.controller.TaxJurisdictionController;
import com.autotax.api.dto.response.LocalRateResponse;
import com.autotax.api.dto.response.StateListResponse;
import com.autotax.config.ApiResponseAdvice;
import com.autotax.domain.enums.LocalRateSource;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.exception.BusinessException;
import com.autotax.exception.ErrorCode;
import com.autotax.exception.GlobalExceptionHandler;
import com.autotax.exception.ResourceNotFoundException;
import com.autotax.service.TaxJurisdictionService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TaxJurisdictionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private TaxJurisdictionService taxJurisdictionService;

    @BeforeEach
    void setUp() {
        TaxJurisdictionController controller = new TaxJurisdictionController(taxJurisdictionService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("State list separates implemented and stub states")
    void listStates() throws Exception {
        when(taxJurisdictionService.listStates())
                .thenReturn(StateListResponse.builder()
                        .implementedStates(List.of("AZ", "IN"))
                        .stubStates(List.of("CA"))
                        .build());

        mockMvc.perform(get("/api/tax/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.implementedStates[1]").value("IN"))
                .andExpect(jsonPath("$.data.stubStates[0]").value("CA"));
    }

    @Test
    @DisplayName("Rules of one state are returned as stored")
    void getRules() throws Exception {
        when(taxJurisdictionService.getRules("ts")).thenReturn(retailRules());

        mockMvc.perform(get("/api/tax/states/ts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.stateCode").value("TS"))
                .andExpect(jsonPath("$.data.tradeInPolicy.type").value("FULL"))
                .andExpect(jsonPath("$.data.leaseRules.method").value("MONTHLY"));
    }

    @Test
    @DisplayName("Unknown state maps to 404")
    void getRules_unknownState() throws Exception {
        when(taxJurisdictionService.getRules("TX"))
                .thenThrow(ResourceNotFoundException.taxRules("TX"));

        mockMvc.perform(get("/api/tax/states/TX"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.message").value("No tax rules for state TX"))
                .andExpect(jsonPath("$.error.details.stateCode").value("TX"));
    }

    @Test
    @DisplayName("Local rates for a ZIP include the resulting components")
    void lookupLocalRates() throws Exception {
        LocalTaxRateInfo info = LocalTaxRateInfo.builder()
                .zipCode("85004")
                .stateCode("AZ")
                .city("Phoenix")
                .stateTaxRate(new BigDecimal("0.056"))
                .countyRate(new BigDecimal("0.007"))
                .cityRate(new BigDecimal("0.023"))
                .specialDistrictRate(BigDecimal.ZERO)
                .source(LocalRateSource.ZIP_EXACT)
                .build();
        when(taxJurisdictionService.lookupLocalRates("85004", "AZ"))
                .thenReturn(LocalRateResponse.builder()
                        .rateInfo(info)
                        .combinedRate(info.getCombinedRate())
                        .rateComponents(List.of(
                                TaxRateComponent.of("STATE", new BigDecimal("0.056")),
                                TaxRateComponent.of("COUNTY", new BigDecimal("0.007")),
                                TaxRateComponent.of("CITY", new BigDecimal("0.023"))))
                        .build());

        mockMvc.perform(get("/api/tax/local/85004").param("stateCode", "AZ"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rateInfo.source").value("ZIP_EXACT"))
                .andExpect(jsonPath("$.data.combinedRate").value(0.086))
                .andExpect(jsonPath("$.data.rateComponents.length()").value(3))
                .andExpect(jsonPath("$.data.rateComponents[0].state").doesNotExist());
    }

    @Test
    @DisplayName("Malformed ZIP maps to 400")
    void lookupLocalRates_badZip() throws Exception {
        when(taxJurisdictionService.lookupLocalRates("85", null))
                .thenThrow(new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid ZIP code: 85"));

        mockMvc.perform(get("/api/tax/local/85"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }
}
