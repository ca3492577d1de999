package com.autotax.unit.service;

import static com.autotax.fixtures.TaxRulesFixtures.retailRules;
import static com.autotax.fixtures.TaxRulesFixtures.stateRate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autotax.config.AutotaxConfig;
import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.LocalRateSource;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.engine.TaxCalculationEngine;
import com.autotax.exception.BusinessException;
import com.autotax.exception.ErrorCode;
import com.autotax.exception.ResourceNotFoundException;
import com.autotax.localtax.LocalTaxRateService;
import com.autotax.observability.TaxMetricsService;
import com.autotax.rules.TaxRulesRegistry;
import com.autotax.service.TaxCalculationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for TaxCalculationService: jurisdiction resolution, stub handling,
 * ZIP-based rate resolution and metrics. The engine is real; the local rate table is mocked.
 *
 * <p>Registry: TS (retail baseline), ST (stub copy of TS), LO (TS without local vehicle tax).
 */
@ExtendWith(MockitoExtension.class)
class TaxCalculationServiceTest {

    @Mock
    private LocalTaxRateService localTaxRateService;

    private MeterRegistry meterRegistry;
    private AutotaxConfig autotaxConfig;
    private TaxCalculationService service;

    @BeforeEach
    void setUp() {
        TaxRulesRegistry registry = new TaxRulesRegistry(List.of(
                retailRules(),
                retailRules().toBuilder().stateCode("ST").stub(true).build(),
                retailRules().toBuilder().stateCode("LO").vehicleUsesLocalSalesTax(false).build()));
        meterRegistry = new SimpleMeterRegistry();
        autotaxConfig = new AutotaxConfig();
        service = new TaxCalculationService(
                registry,
                localTaxRateService,
                new TaxCalculationEngine(),
                new TaxMetricsService(meterRegistry),
                autotaxConfig);
    }

    private static TaxCalculationInput deal(String price) {
        return TaxCalculationInput.builder()
                .dealType(DealType.RETAIL)
                .vehiclePrice(new BigDecimal(price))
                .build();
    }

    private static LocalTaxRateInfo phoenix(String stateCode) {
        return LocalTaxRateInfo.builder()
                .zipCode("85004")
                .stateCode(stateCode)
                .stateTaxRate(new BigDecimal("0.056"))
                .countyRate(new BigDecimal("0.007"))
                .cityRate(new BigDecimal("0.023"))
                .specialDistrictRate(BigDecimal.ZERO)
                .source(LocalRateSource.ZIP_EXACT)
                .build();
    }

    // ==============================
    // JURISDICTION RESOLUTION
    // ==============================

    @Nested
    @DisplayName("Jurisdiction resolution")
    class JurisdictionResolution {

        @Test
        @DisplayName("Unknown state is not found")
        void unknownState_notFound() {
            assertThatThrownBy(() -> service.calculate("TX", null, deal("20000")))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("TX");
        }

        @Test
        @DisplayName("State codes resolve case-insensitively with the US_ prefix")
        void prefixedCode_resolves() {
            TaxCalculationResult result = service.calculate(
                    "us_ts", null, deal("20000").toBuilder().rates(stateRate("0.06")).build());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1200");
        }

        @Test
        @DisplayName("Stub state calculates by default")
        void stubState_allowedByDefault() {
            TaxCalculationResult result = service.calculate(
                    "ST", null, deal("20000").toBuilder().rates(stateRate("0.06")).build());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1200");
        }

        @Test
        @DisplayName("Stub state is refused when stubs are rejected")
        void stubState_rejected() {
            autotaxConfig.getCalculation().setRejectStubStates(true);

            assertThatThrownBy(() -> service.calculate("ST", null, deal("20000")))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.STATE_NOT_IMPLEMENTED);
        }
    }

    // ==============================
    // RATE RESOLUTION
    // ==============================

    @Nested
    @DisplayName("Rate resolution")
    class RateResolution {

        @Test
        @DisplayName("Deal without rates takes them from the ZIP lookup")
        void ratesFromZip() {
            when(localTaxRateService.lookup("85004", "TS")).thenReturn(phoenix("TS"));

            TaxCalculationResult result = service.calculate("TS", "85004", deal("20000"));

            List<ComponentTax> components = result.getTaxes().getComponentTaxes();
            assertThat(components).extracting(ComponentTax::getLabel).containsExactly("STATE", "COUNTY", "CITY");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1720");
        }

        @Test
        @DisplayName("State without local vehicle tax keeps only the STATE component")
        void noLocalVehicleTax_stateOnly() {
            when(localTaxRateService.lookup("85004", "LO")).thenReturn(phoenix("LO"));

            TaxCalculationResult result = service.calculate("LO", "85004", deal("20000"));

            assertThat(result.getTaxes().getComponentTaxes()).extracting(ComponentTax::getLabel)
                    .containsExactly("STATE");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1120");
        }

        @Test
        @DisplayName("Deal with a null rate list takes its rates from the ZIP lookup")
        void nullRates_fromZip() {
            when(localTaxRateService.lookup("85004", "TS")).thenReturn(phoenix("TS"));

            TaxCalculationResult result =
                    service.calculate("TS", "85004", deal("20000").toBuilder().rates(null).otherFees(null).build());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1720");
        }

        @Test
        @DisplayName("Deal with a null rate list and no ZIP calculates zero tax")
        void nullRates_noZip() {
            TaxCalculationResult result = service.calculate("TS", null, deal("20000").toBuilder().rates(null).build());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("0");
            verify(localTaxRateService, never()).lookup(anyString(), any());
        }

        @Test
        @DisplayName("Rates supplied on the deal win over the ZIP code")
        void suppliedRates_noLookup() {
            service.calculate("TS", "85004", deal("20000").toBuilder().rates(stateRate("0.05")).build());

            verify(localTaxRateService, never()).lookup(anyString(), any());
        }

        @Test
        @DisplayName("resolveRates filters local components by the state's rules")
        void resolveRates() {
            List<TaxRateComponent> all = service.resolveRates(phoenix("TS"), service.getRules("TS"));
            List<TaxRateComponent> stateOnly = service.resolveRates(phoenix("LO"), service.getRules("LO"));

            assertThat(all).hasSize(3);
            assertThat(stateOnly).extracting(TaxRateComponent::getLabel).containsExactly("STATE");
        }
    }

    // ==============================
    // METRICS
    // ==============================

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Each calculation is counted by deal type")
        void calculationCounted() {
            service.calculate("TS", null, deal("20000").toBuilder().rates(stateRate("0.06")).build());

            assertThat(meterRegistry
                            .get("tax.calculations.count")
                            .tag("dealType", "RETAIL")
                            .counter()
                            .count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("tax.calculation.latency").timer().count())
                    .isEqualTo(1L);
        }

        @Test
        @DisplayName("Calculations with configuration gaps are counted as degraded")
        void degradedCounted() {
            service.calculate("TS", null, deal("20000"));
            service.calculate(
                    "TS",
                    null,
                    deal("20000").toBuilder().rates(stateRate("0.06")).build());

            assertThat(meterRegistry.get("tax.calculations.degraded").counter().count())
                    .isEqualTo(0.0);

            TaxCalculationInput unknownType = deal("20000").toBuilder()
                    .dealType(null)
                    .rates(stateRate("0.06"))
                    .build();
            TaxCalculationResult result = service.calculate("TS", null, unknownType);

            assertThat(result.getMode()).isEqualTo(DealType.RETAIL);
            assertThat(meterRegistry.get("tax.calculations.degraded").counter().count())
                    .isEqualTo(1.0);
        }
    }
}
