package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.model.HighwayUseTaxRules;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import com.autotax.engine.TitlingTaxResults.AddOns;
import java.math.BigDecimal;
import java.util.List;

/**
 * Highway use tax: a state-only tax on the net vehicle price. Local rate components
 * never apply.
 *
 * <p>Vehicle base = price (or gross cap cost on a lease) + taxable accessories, less the
 * trade-in when allowed and the manufacturer rebate, plus taxable negative equity.
 * Dealer rebates stay in the base. Doc fee, fees and products join per the
 * jurisdiction's retail taxability rules.
 */
final class HighwayUseTaxCalculator {

    private static final String SCHEME = "HUT";

    private HighwayUseTaxCalculator() {}

    static TaxCalculationResult calculate(
            TaxCalculationInput input, TaxRulesConfig rules, HighwayUseTaxRules hut, List<String> notes) {
        notes.add("Vehicle tax scheme: SPECIAL_HUT (state-only highway use tax, local rates ignored)");

        BigDecimal base = input.getDealType() == DealType.LEASE
                ? TitlingTaxResults.leaseCapCost(input)
                : Amounts.nonNegative(input.getVehiclePrice());
        if (rules.isTaxOnAccessories()) {
            base = base.add(Amounts.nonNegative(input.getAccessoriesAmount()));
        } else if (Amounts.isPositive(input.getAccessoriesAmount())) {
            notes.add(SCHEME + ": accessories " + display(input.getAccessoriesAmount()) + " excluded from the base");
        }

        BigDecimal appliedTradeIn = BigDecimal.ZERO;
        BigDecimal tradeIn = Amounts.nonNegative(input.getTradeInValue());
        if (tradeIn.signum() > 0) {
            if (hut.isIncludeTradeInReduction()) {
                appliedTradeIn = Amounts.min(tradeIn, base);
                base = base.subtract(appliedTradeIn);
                notes.add(SCHEME + ": trade-in " + display(appliedTradeIn) + " reduces the base");
            } else {
                notes.add(SCHEME + ": trade-in " + display(tradeIn) + " gives no credit");
            }
        }

        BigDecimal rebatesNonTaxable = Amounts.min(Amounts.nonNegative(input.getRebateManufacturer()), base);
        if (rebatesNonTaxable.signum() > 0) {
            base = base.subtract(rebatesNonTaxable);
            notes.add(SCHEME + ": manufacturer rebate " + display(rebatesNonTaxable) + " reduces the base");
        }
        BigDecimal rebatesTaxable = Amounts.nonNegative(input.getRebateDealer());
        if (rebatesTaxable.signum() > 0) {
            notes.add(SCHEME + ": dealer rebate " + display(rebatesTaxable) + " is taxable (does not reduce the base)");
        }

        if (Amounts.isPositive(input.getNegativeEquity())) {
            if (rules.isTaxOnNegativeEquity()) {
                base = base.add(input.getNegativeEquity());
            } else {
                notes.add(SCHEME + ": negative equity " + display(input.getNegativeEquity())
                        + " excluded from the base");
            }
        }
        BigDecimal vehicleBase = Amounts.nonNegative(base);

        AddOns addOns = TitlingTaxResults.addOns(input, rules, SCHEME, notes);
        TaxBaseBreakdown bases = TaxBaseBreakdown.of(vehicleBase, addOns.getFeesBase(), addOns.productsBase());
        notes.add(SCHEME + ": base " + display(bases.getTotalTaxableBase()));

        TaxDebug.TaxDebugBuilder debug = TaxDebug.builder()
                .appliedTradeIn(appliedTradeIn)
                .appliedRebatesTaxable(rebatesTaxable)
                .appliedRebatesNonTaxable(rebatesNonTaxable)
                .taxableDocFee(addOns.getTaxableDocFee())
                .taxableFees(addOns.getTaxableFees())
                .taxableServiceContracts(addOns.getTaxableServiceContracts())
                .taxableGap(addOns.getTaxableGap());
        return TitlingTaxResults.assemble(
                input,
                rules,
                TitlingTaxResults.schemeRate(rules, SCHEME, hut.getRate(), input, notes),
                bases,
                hut.getMaxReciprocityAgeDays(),
                debug,
                notes);
    }
}
