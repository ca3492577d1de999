package com.autotax.unit.engine;

import static com.autotax.fixtures.TaxRulesFixtures.retailRules;
import static com.autotax.fixtures.TaxRulesFixtures.stateCountyCity;
import static com.autotax.fixtures.TaxRulesFixtures.stateRate;
import static org.assertj.core.api.Assertions.assertThat;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.ReciprocityBehavior;
import com.autotax.domain.enums.ReciprocityScope;
import com.autotax.domain.enums.TavtLeaseBaseMode;
import com.autotax.domain.enums.VehicleClass;
import com.autotax.domain.enums.VehicleTaxScheme;
import com.autotax.domain.model.HighwayUseTaxRules;
import com.autotax.domain.model.LeaseTerms;
import com.autotax.domain.model.PrivilegeTaxRules;
import com.autotax.domain.model.ReciprocityRules;
import com.autotax.domain.model.TavtRules;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxCap;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.model.TaxRulesExtras;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.LeaseTaxBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.engine.TaxCalculationEngine;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the titling-tax schemes (TAVT, highway use tax, privilege tax) through
 * TaxCalculationEngine.
 *
 * <p>Each scheme uses the retail fixture rules with the scheme's parameter block: TAVT 7%,
 * HUT 3% with a 90-day reciprocity window, privilege tax 5% with RV 6% and trailer 3%.
 * Deal rates are deliberately different from the scheme rate to show they are ignored.
 */
class TitlingTaxCalculationTest {

    private TaxCalculationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TaxCalculationEngine();
    }

    private static TavtRules.TavtRulesBuilder tavt() {
        return TavtRules.builder()
                .rate(new BigDecimal("0.07"))
                .useHigherOfPriceOrAssessed(true)
                .allowTradeInCredit(true)
                .applyNegativeEquityToBase(true)
                .leaseBaseMode(TavtLeaseBaseMode.AGREED_VALUE);
    }

    private static TaxRulesConfig tavtRules(TavtRules tavt) {
        return retailRules().toBuilder()
                .stateCode("GA")
                .vehicleTaxScheme(VehicleTaxScheme.SPECIAL_TAVT)
                .extras(TaxRulesExtras.builder().tavt(tavt).build())
                .build();
    }

    private static TaxRulesConfig hutRules() {
        return retailRules().toBuilder()
                .stateCode("NC")
                .vehicleTaxScheme(VehicleTaxScheme.SPECIAL_HUT)
                .extras(TaxRulesExtras.builder()
                        .highwayUseTax(HighwayUseTaxRules.builder()
                                .rate(new BigDecimal("0.03"))
                                .includeTradeInReduction(true)
                                .maxReciprocityAgeDays(90)
                                .build())
                        .build())
                .reciprocity(ReciprocityRules.builder()
                        .enabled(true)
                        .scope(ReciprocityScope.BOTH)
                        .homeStateBehavior(ReciprocityBehavior.CREDIT_UP_TO_STATE_RATE)
                        .capAtThisStatesTax(true)
                        .build())
                .build();
    }

    private static TaxRulesConfig privilegeRules() {
        return retailRules().toBuilder()
                .stateCode("WV")
                .vehicleTaxScheme(VehicleTaxScheme.DMV_PRIVILEGE_TAX)
                .extras(TaxRulesExtras.builder()
                        .privilegeTax(PrivilegeTaxRules.builder()
                                .rate(new BigDecimal("0.05"))
                                .useHigherOfPriceOrAssessed(true)
                                .allowTradeInCredit(true)
                                .applyNegativeEquityToBase(true)
                                .vehicleClassRates(Map.of(
                                        VehicleClass.RV, new BigDecimal("0.06"),
                                        VehicleClass.TRAILER, new BigDecimal("0.03")))
                                .build())
                        .build())
                .build();
    }

    private static TaxCalculationInput.TaxCalculationInputBuilder retail(String vehiclePrice) {
        return TaxCalculationInput.builder()
                .dealType(DealType.RETAIL)
                .vehiclePrice(new BigDecimal(vehiclePrice))
                .rates(stateCountyCity("0.04", "0.02", "0.01"));
    }

    private static TaxCalculationInput.TaxCalculationInputBuilder lease(String agreedValue, String grossCapCost) {
        return TaxCalculationInput.builder()
                .dealType(DealType.LEASE)
                .vehiclePrice(new BigDecimal(agreedValue))
                .rates(stateRate("0.04"))
                .leaseTerms(LeaseTerms.builder()
                        .grossCapCost(new BigDecimal(grossCapCost))
                        .basePayment(new BigDecimal("500"))
                        .paymentCount(36)
                        .build());
    }

    // ==============================
    // TITLE AD VALOREM TAX
    // ==============================

    @Nested
    @DisplayName("Title ad valorem tax")
    class TitleAdValorem {

        @Test
        @DisplayName("Trade-in reduces the vehicle base; rebates, fees and products stay out of the calculation")
        void retail_vehicleOnlyBase() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .tradeInValue(new BigDecimal("5000"))
                            .rebateManufacturer(new BigDecimal("1000"))
                            .docFee(new BigDecimal("500"))
                            .serviceContracts(new BigDecimal("2000"))
                            .build(),
                    tavtRules(tavt().build()));

            assertThat(result.getBases().getVehicleBase()).isEqualByComparingTo("25000");
            assertThat(result.getBases().getFeesBase()).isEqualByComparingTo("0");
            assertThat(result.getBases().getProductsBase()).isEqualByComparingTo("0");
            assertThat(result.getTaxes().getComponentTaxes())
                    .singleElement()
                    .satisfies(component -> {
                        assertThat(component.getLabel()).isEqualTo("GA_TAVT");
                        assertThat(component.getAmount()).isEqualByComparingTo("1750");
                    });
            assertThat(result.getDebug().getAppliedRebatesTaxable()).isEqualByComparingTo("1000");
            assertThat(result.getDebug().getNotes()).anyMatch(note -> note.contains("outside the base"));
        }

        @Test
        @DisplayName("Assessed value above the price becomes the base")
        void assessedValue_higherWins() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000").assessedValue(new BigDecimal("32000")).build(), tavtRules(tavt().build()));

            assertThat(result.getBases().getVehicleBase()).isEqualByComparingTo("32000");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("2240");
        }

        @Test
        @DisplayName("Assessed value is ignored when the rules measure on price alone")
        void assessedValue_ignoredWhenDisabled() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000").assessedValue(new BigDecimal("32000")).build(),
                    tavtRules(tavt().useHigherOfPriceOrAssessed(false).build()));

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("2100");
        }

        @Test
        @DisplayName("Trade-in gives no credit when the rules disallow it; negative equity joins the base")
        void tradeInDisallowed_negativeEquityAdded() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .tradeInValue(new BigDecimal("5000"))
                            .negativeEquity(new BigDecimal("2000"))
                            .build(),
                    tavtRules(tavt().allowTradeInCredit(false).build()));

            assertThat(result.getBases().getVehicleBase()).isEqualByComparingTo("32000");
            assertThat(result.getDebug().getAppliedTradeIn()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Lease is taxed once at signing on the agreed value")
        void lease_agreedValue() {
            TaxCalculationResult result =
                    engine.calculateTax(lease("40000", "42000").build(), tavtRules(tavt().build()));

            LeaseTaxBreakdown breakdown = result.getLeaseBreakdown();
            assertThat(result.getMode()).isEqualTo(DealType.LEASE);
            assertThat(breakdown.getUpfrontTaxes().getTotalTax()).isEqualByComparingTo("2800");
            assertThat(breakdown.getPaymentTaxesPerPeriod().getTotalTax()).isEqualByComparingTo("0");
            assertThat(breakdown.getPaymentCount()).isEqualTo(36);
            assertThat(breakdown.getTotalTaxOverTerm()).isEqualByComparingTo("2800");
        }

        @Test
        @DisplayName("CAP_COST lease mode measures the lease on the gross cap cost")
        void lease_capCostMode() {
            TaxCalculationResult result = engine.calculateTax(
                    lease("40000", "42000").build(),
                    tavtRules(tavt().leaseBaseMode(TavtLeaseBaseMode.CAP_COST).build()));

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("2940");
            assertThat(result.getLeaseBreakdown().getTotalTaxOverTerm()).isEqualByComparingTo("2940");
        }

        @Test
        @DisplayName("Missing scheme rate falls back to the STATE rate with a warning")
        void missingRate_fallsBackToStateRate() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000").build(), tavtRules(tavt().rate(null).build()));

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1200");
            assertThat(result.getDebug().isDegraded()).isTrue();
            assertThat(result.getDebug().getNotes()).anyMatch(note -> note.startsWith("WARNING: No TAVT rate"));
        }

        @Test
        @DisplayName("Dollar cap still limits a titling tax")
        void cap_applies() {
            TaxRulesConfig capped =
                    tavtRules(tavt().build()).toBuilder().taxCap(TaxCap.of(new BigDecimal("1000"))).build();

            TaxCalculationResult result = engine.calculateTax(retail("30000").build(), capped);

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1000");
            assertThat(result.getDebug().isTaxCapApplied()).isTrue();
        }
    }

    // ==============================
    // HIGHWAY USE TAX
    // ==============================

    @Nested
    @DisplayName("Highway use tax")
    class HighwayUse {

        @Test
        @DisplayName("Manufacturer rebate and trade-in reduce the base; dealer rebate and taxable add-ons do not")
        void retail_netPriceBase() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .accessoriesAmount(new BigDecimal("1000"))
                            .tradeInValue(new BigDecimal("5000"))
                            .rebateManufacturer(new BigDecimal("1000"))
                            .rebateDealer(new BigDecimal("500"))
                            .docFee(new BigDecimal("500"))
                            .serviceContracts(new BigDecimal("2000"))
                            .gap(new BigDecimal("800"))
                            .build(),
                    hutRules());

            assertThat(result.getBases().getVehicleBase()).isEqualByComparingTo("25000");
            assertThat(result.getBases().getFeesBase()).isEqualByComparingTo("500");
            assertThat(result.getBases().getProductsBase()).isEqualByComparingTo("2000");
            assertThat(result.getTaxes().getComponentTaxes())
                    .extracting(ComponentTax::getLabel)
                    .containsExactly("NC_HUT");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("825");
            assertThat(result.getDebug().getAppliedRebatesNonTaxable()).isEqualByComparingTo("1000");
            assertThat(result.getDebug().getAppliedRebatesTaxable()).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("Tax paid elsewhere within the window is credited")
        void reciprocity_insideWindow() {
            LocalDate asOf = LocalDate.of(2024, 9, 1);
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .taxAlreadyCollected(new BigDecimal("300"))
                            .originState("VA")
                            .originTaxPaidDate(asOf.minusDays(60))
                            .asOfDate(asOf)
                            .build(),
                    hutRules());

            assertThat(result.getTaxes().getGrossTax()).isEqualByComparingTo("900");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("600");
        }

        @Test
        @DisplayName("Tax paid elsewhere outside the window is not credited")
        void reciprocity_outsideWindow() {
            LocalDate asOf = LocalDate.of(2024, 9, 1);
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .taxAlreadyCollected(new BigDecimal("300"))
                            .originState("VA")
                            .originTaxPaidDate(asOf.minusDays(120))
                            .asOfDate(asOf)
                            .build(),
                    hutRules());

            assertThat(result.getDebug().getReciprocityCredit()).isEqualByComparingTo("0");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("900");
            assertThat(result.getDebug().getNotes()).anyMatch(note -> note.contains("outside the 90-day window"));
        }

        @Test
        @DisplayName("Lease pays the whole tax on the gross cap cost at signing")
        void lease_capCost() {
            TaxCalculationResult result = engine.calculateTax(lease("40000", "35000").build(), hutRules());

            assertThat(result.getLeaseBreakdown().getUpfrontTaxes().getTotalTax()).isEqualByComparingTo("1050");
            assertThat(result.getLeaseBreakdown().getPaymentTaxableBasePerPeriod()).isEqualByComparingTo("0");
            assertThat(result.getLeaseBreakdown().getTotalTaxOverTerm()).isEqualByComparingTo("1050");
        }
    }

    // ==============================
    // PRIVILEGE TAX
    // ==============================

    @Nested
    @DisplayName("Privilege tax")
    class Privilege {

        @Test
        @DisplayName("Rebates stay in the base; taxable doc fee and service contract join it")
        void retail_passenger() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000")
                            .tradeInValue(new BigDecimal("5000"))
                            .rebateManufacturer(new BigDecimal("1000"))
                            .docFee(new BigDecimal("500"))
                            .serviceContracts(new BigDecimal("2000"))
                            .gap(new BigDecimal("800"))
                            .build(),
                    privilegeRules());

            assertThat(result.getBases().getVehicleBase()).isEqualByComparingTo("25000");
            assertThat(result.getBases().getTotalTaxableBase()).isEqualByComparingTo("27500");
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1375");
            assertThat(result.getDebug().getAppliedRebatesTaxable()).isEqualByComparingTo("1000");
            assertThat(result.getTaxes().getComponentTaxes().get(0).getLabel()).isEqualTo("WV_PRIVILEGE");
        }

        @Test
        @DisplayName("Vehicle class selects its own rate")
        void classRates() {
            TaxCalculationResult rv = engine.calculateTax(
                    retail("80000").vehicleClass(VehicleClass.RV).build(), privilegeRules());
            TaxCalculationResult trailer = engine.calculateTax(
                    retail("10000").vehicleClass(VehicleClass.TRAILER).build(), privilegeRules());

            assertThat(rv.getTaxes().getTotalTax()).isEqualByComparingTo("4800");
            assertThat(trailer.getTaxes().getTotalTax()).isEqualByComparingTo("300");
        }

        @Test
        @DisplayName("Class inferred from weight without a listed rate uses the base rate")
        void inferredClass_baseRate() {
            TaxCalculationResult result =
                    engine.calculateTax(retail("60000").gvwLbs(33_000).build(), privilegeRules());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("3000");
            assertThat(result.getDebug().getNotes()).anyMatch(note -> note.contains("no rate listed for HEAVY_TRUCK"));
        }

        @Test
        @DisplayName("Assessed value above the price becomes the base")
        void assessedValue_higherWins() {
            TaxCalculationResult result = engine.calculateTax(
                    retail("30000").assessedValue(new BigDecimal("35000")).build(), privilegeRules());

            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("1750");
        }
    }

    // ==============================
    // WITHOUT SCHEME PARAMETERS
    // ==============================

    @Nested
    @DisplayName("Without scheme parameters")
    class WithoutParameters {

        @Test
        @DisplayName("Scheme without its parameter block is taxed on the sales-tax base with every rate")
        void passThrough() {
            TaxRulesConfig rules = retailRules().toBuilder()
                    .stateCode("GA")
                    .vehicleTaxScheme(VehicleTaxScheme.SPECIAL_TAVT)
                    .build();

            TaxCalculationResult result = engine.calculateTax(retail("30000").build(), rules);

            assertThat(result.getTaxes().getComponentTaxes()).hasSize(3);
            assertThat(result.getTaxes().getTotalTax()).isEqualByComparingTo("2100");
            assertThat(result.getDebug().getNotes())
                    .anyMatch(note -> note.contains("No SPECIAL_TAVT parameters configured for GA"));
        }

        @Test
        @DisplayName("Parameter block for another scheme is not used")
        void mismatchedBlock_ignored() {
            TaxRulesConfig rules = privilegeRules().toBuilder()
                    .vehicleTaxScheme(VehicleTaxScheme.SPECIAL_HUT)
                    .build();

            TaxCalculationResult result = engine.calculateTax(retail("30000").build(), rules);

            assertThat(result.getTaxes().getComponentTaxes()).hasSize(3);
        }
    }
}
