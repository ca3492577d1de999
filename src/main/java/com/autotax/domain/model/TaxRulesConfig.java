package com.autotax.domain.model;

import com.autotax.domain.enums.VehicleTaxScheme;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The complete vehicle tax policy of one jurisdiction. Supplied whole by
 * {@link com.autotax.rules.TaxRulesRegistry} and treated as read-only.
 *
 * <p>Enum-typed fields may be null when a rule document names a variant this build does
 * not know; the engine degrades those to its most conservative behavior and says so in
 * the debug notes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TaxRulesConfig {

    String stateCode;
    int version;

    /** Placeholder document that has not been researched yet. */
    boolean stub;

    TradeInPolicy tradeInPolicy;

    @Builder.Default
    List<RebateRule> rebates = List.of();

    boolean docFeeTaxable;

    @Builder.Default
    List<FeeTaxRule> feeTaxRules = List.of();

    boolean taxOnAccessories;
    boolean taxOnNegativeEquity;
    boolean taxOnServiceContracts;
    boolean taxOnGap;

    VehicleTaxScheme vehicleTaxScheme;
    boolean vehicleUsesLocalSalesTax;

    LeaseRules leaseRules;

    @Builder.Default
    ReciprocityRules reciprocity = ReciprocityRules.disabled();

    /** Optional; null means uncapped. */
    TaxCap taxCap;

    /** Titling-tax scheme parameters; null for sales-tax jurisdictions. */
    TaxRulesExtras extras;

    String notes;
}
