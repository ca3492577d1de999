package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.VehicleClass;
import com.autotax.domain.model.PrivilegeTaxRules;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import com.autotax.engine.TitlingTaxResults.AddOns;
import java.math.BigDecimal;
import java.util.List;

/**
 * DMV privilege tax collected at titling. Both rebate parties stay in the base and the
 * rate is chosen by vehicle class.
 */
final class PrivilegeTaxCalculator {

    private static final String SCHEME = "PRIVILEGE";

    private PrivilegeTaxCalculator() {}

    static TaxCalculationResult calculate(
            TaxCalculationInput input, TaxRulesConfig rules, PrivilegeTaxRules privilege, List<String> notes) {
        notes.add("Vehicle tax scheme: DMV_PRIVILEGE_TAX (privilege tax collected at titling)");

        BigDecimal base = input.getDealType() == DealType.LEASE
                ? TitlingTaxResults.leaseCapCost(input)
                : Amounts.nonNegative(input.getVehiclePrice());
        if (privilege.isUseHigherOfPriceOrAssessed()) {
            base = TitlingTaxResults.higherOfAssessed(base, input, SCHEME, notes);
        }

        BigDecimal appliedTradeIn = BigDecimal.ZERO;
        BigDecimal tradeIn = Amounts.nonNegative(input.getTradeInValue());
        if (tradeIn.signum() > 0) {
            if (privilege.isAllowTradeInCredit()) {
                appliedTradeIn = Amounts.min(tradeIn, base);
                base = base.subtract(appliedTradeIn);
                notes.add(SCHEME + ": trade-in " + display(appliedTradeIn) + " reduces the base");
            } else {
                notes.add(SCHEME + ": trade-in " + display(tradeIn) + " gives no credit");
            }
        }

        BigDecimal rebates = Amounts.nonNegative(input.getRebateManufacturer())
                .add(Amounts.nonNegative(input.getRebateDealer()));
        if (rebates.signum() > 0) {
            notes.add(SCHEME + ": rebates " + display(rebates) + " are taxable (do not reduce the base)");
        }

        if (Amounts.isPositive(input.getNegativeEquity())) {
            if (privilege.isApplyNegativeEquityToBase()) {
                base = base.add(input.getNegativeEquity());
            } else {
                notes.add(SCHEME + ": negative equity " + display(input.getNegativeEquity())
                        + " excluded from the base");
            }
        }
        if (rules.isTaxOnAccessories()) {
            base = base.add(Amounts.nonNegative(input.getAccessoriesAmount()));
        } else if (Amounts.isPositive(input.getAccessoriesAmount())) {
            notes.add(SCHEME + ": accessories " + display(input.getAccessoriesAmount()) + " excluded from the base");
        }
        BigDecimal vehicleBase = Amounts.nonNegative(base);

        AddOns addOns = TitlingTaxResults.addOns(input, rules, SCHEME, notes);
        TaxBaseBreakdown bases = TaxBaseBreakdown.of(vehicleBase, addOns.getFeesBase(), addOns.productsBase());
        notes.add(SCHEME + ": base " + display(bases.getTotalTaxableBase()));

        TaxDebug.TaxDebugBuilder debug = TaxDebug.builder()
                .appliedTradeIn(appliedTradeIn)
                .appliedRebatesTaxable(rebates)
                .appliedRebatesNonTaxable(BigDecimal.ZERO)
                .taxableDocFee(addOns.getTaxableDocFee())
                .taxableFees(addOns.getTaxableFees())
                .taxableServiceContracts(addOns.getTaxableServiceContracts())
                .taxableGap(addOns.getTaxableGap());
        return TitlingTaxResults.assemble(
                input,
                rules,
                TitlingTaxResults.schemeRate(rules, SCHEME, classRate(privilege, input, notes), input, notes),
                bases,
                null,
                debug,
                notes);
    }

    /** The vehicle class's rate when listed, otherwise the base rate. */
    private static BigDecimal classRate(PrivilegeTaxRules privilege, TaxCalculationInput input, List<String> notes) {
        VehicleClass vehicleClass = VehicleClass.resolve(input.getVehicleClass(), input.getGvwLbs());
        BigDecimal classRate = privilege.getVehicleClassRates() != null
                ? privilege.getVehicleClassRates().get(vehicleClass)
                : null;
        if (classRate != null) {
            notes.add(SCHEME + ": " + vehicleClass + " rate " + Amounts.displayRate(classRate));
            return classRate;
        }
        if (privilege.getRate() != null) {
            notes.add(SCHEME + ": no rate listed for " + vehicleClass + "; base rate "
                    + Amounts.displayRate(privilege.getRate()));
        }
        return privilege.getRate();
    }
}
