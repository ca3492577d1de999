package com.autotax.domain.model;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.VehicleClass;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One vehicle transaction to be taxed. Built by the caller per calculation and never
 * mutated by the engine. Amount fields default to zero; {@code rates} must already be
 * the rate components for the deal's location.
 *
 * <p>The origin fields feed reciprocity: {@code originState} selects a reciprocity
 * override (together with the vehicle class and weight) and the dates drive time-window
 * checks. {@code asOfDate} is supplied by the caller so the calculation never depends on
 * the wall clock.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TaxCalculationInput {

    @Builder.Default
    DealType dealType = DealType.RETAIL;

    @Builder.Default
    BigDecimal vehiclePrice = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal accessoriesAmount = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal tradeInValue = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal rebateManufacturer = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal rebateDealer = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal docFee = BigDecimal.ZERO;

    @Builder.Default
    List<FeeLine> otherFees = List.of();

    @Builder.Default
    BigDecimal serviceContracts = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal gap = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal negativeEquity = BigDecimal.ZERO;

    /** Tax already paid to another jurisdiction on this vehicle. */
    @Builder.Default
    BigDecimal taxAlreadyCollected = BigDecimal.ZERO;

    @Builder.Default
    List<TaxRateComponent> rates = List.of();

    /** Required for meaningful LEASE results; ignored for RETAIL. */
    LeaseTerms leaseTerms;

    /** Null means inferred from {@code gvwLbs}, else PASSENGER. */
    VehicleClass vehicleClass;

    Integer gvwLbs;

    /** DMV assessed value, for titling taxes measured on the higher of price or assessed value. */
    BigDecimal assessedValue;

    String originState;

    Boolean originIsHomeState;

    /** Same owner titled the vehicle where the earlier tax was paid. */
    Boolean originSameOwner;

    LocalDate originTaxPaidDate;

    LocalDate asOfDate;
}
