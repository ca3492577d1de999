package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.TavtLeaseBaseMode;
import com.autotax.domain.model.TavtRules;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import java.math.BigDecimal;
import java.util.List;

/**
 * Title ad valorem tax: a one-time tax on the vehicle alone.
 *
 * <ol>
 *   <li>base: vehicle price (retail) or the lease base mode's value, raised to the assessed
 *       value when configured and higher</li>
 *   <li>trade-in reduces the base when allowed; negative equity raises it when configured</li>
 *   <li>rebates never reduce the base; doc fee, fees and products are outside it</li>
 * </ol>
 */
final class TitleAdValoremTaxCalculator {

    private static final String SCHEME = "TAVT";

    private TitleAdValoremTaxCalculator() {}

    static TaxCalculationResult calculate(
            TaxCalculationInput input, TaxRulesConfig rules, TavtRules tavt, List<String> notes) {
        notes.add("Vehicle tax scheme: SPECIAL_TAVT (one-time title ad valorem tax on the vehicle)");

        BigDecimal base;
        if (input.getDealType() == DealType.LEASE) {
            if (tavt.getLeaseBaseMode() == TavtLeaseBaseMode.CAP_COST) {
                base = TitlingTaxResults.leaseCapCost(input);
                notes.add(SCHEME + ": lease measured on the gross cap cost " + display(base));
            } else {
                base = Amounts.nonNegative(input.getVehiclePrice());
                notes.add(SCHEME + ": lease measured on the agreed value " + display(base));
            }
        } else {
            base = Amounts.nonNegative(input.getVehiclePrice());
        }
        if (tavt.isUseHigherOfPriceOrAssessed()) {
            base = TitlingTaxResults.higherOfAssessed(base, input, SCHEME, notes);
        }

        BigDecimal appliedTradeIn = BigDecimal.ZERO;
        BigDecimal tradeIn = Amounts.nonNegative(input.getTradeInValue());
        if (tradeIn.signum() > 0) {
            if (tavt.isAllowTradeInCredit()) {
                appliedTradeIn = Amounts.min(tradeIn, base);
                base = base.subtract(appliedTradeIn);
                notes.add(SCHEME + ": trade-in " + display(appliedTradeIn) + " reduces the base");
            } else {
                notes.add(SCHEME + ": trade-in " + display(tradeIn) + " gives no credit");
            }
        }
        if (Amounts.isPositive(input.getNegativeEquity())) {
            if (tavt.isApplyNegativeEquityToBase()) {
                base = base.add(input.getNegativeEquity());
            } else {
                notes.add(SCHEME + ": negative equity " + display(input.getNegativeEquity())
                        + " excluded from the base");
            }
        }
        base = Amounts.nonNegative(base);

        BigDecimal rebates = Amounts.nonNegative(input.getRebateManufacturer())
                .add(Amounts.nonNegative(input.getRebateDealer()));
        if (rebates.signum() > 0) {
            notes.add(SCHEME + ": rebates " + display(rebates) + " do not reduce the base");
        }
        if (Amounts.isPositive(input.getDocFee()) || !input.getOtherFees().isEmpty()
                || Amounts.isPositive(input.getServiceContracts()) || Amounts.isPositive(input.getGap())) {
            notes.add(SCHEME + ": doc fee, fees and products are outside the base");
        }
        notes.add(SCHEME + ": base " + display(base));

        TaxDebug.TaxDebugBuilder debug = TaxDebug.builder()
                .appliedTradeIn(appliedTradeIn)
                .appliedRebatesTaxable(rebates)
                .appliedRebatesNonTaxable(BigDecimal.ZERO)
                .taxableDocFee(BigDecimal.ZERO)
                .taxableFees(List.of())
                .taxableServiceContracts(BigDecimal.ZERO)
                .taxableGap(BigDecimal.ZERO);
        return TitlingTaxResults.assemble(
                input,
                rules,
                TitlingTaxResults.schemeRate(rules, SCHEME, tavt.getRate(), input, notes),
                TaxBaseBreakdown.of(base, BigDecimal.ZERO, BigDecimal.ZERO),
                null,
                debug,
                notes);
    }
}
