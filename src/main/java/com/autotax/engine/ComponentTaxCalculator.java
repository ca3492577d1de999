package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.model.FeeLine;
import com.autotax.domain.model.TaxCap;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.TaxAmountBreakdown;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a taxable base and an ordered rate list into per-component taxes, applies the
 * jurisdiction's dollar cap and folds a reciprocity credit into the total.
 */
final class ComponentTaxCalculator {

    private ComponentTaxCalculator() {}

    /** One component per rate, in rate order: {@code amount = base * rate}. */
    static List<ComponentTax> applyRates(BigDecimal base, List<TaxRateComponent> rates) {
        List<ComponentTax> components = new ArrayList<>(rates.size());
        for (TaxRateComponent rate : rates) {
            BigDecimal fraction = Amounts.orZero(rate.getRate());
            components.add(ComponentTax.builder()
                    .label(rate.getLabel())
                    .rate(fraction)
                    .amount(base.multiply(fraction))
                    .build());
        }
        return components;
    }

    /** Flat components for scheme-level special fees; these carry no rate. */
    static List<ComponentTax> flatFees(List<FeeLine> fees) {
        List<ComponentTax> components = new ArrayList<>(fees.size());
        for (FeeLine fee : fees) {
            components.add(ComponentTax.builder()
                    .label(fee.getCode())
                    .amount(Amounts.orZero(fee.getAmount()))
                    .build());
        }
        return components;
    }

    static BigDecimal sum(List<ComponentTax> components) {
        BigDecimal total = BigDecimal.ZERO;
        for (ComponentTax component : components) {
            total = total.add(component.getAmount());
        }
        return total;
    }

    /**
     * Limits the summed tax to {@code cap.maxTaxAmount}. The allowance is handed out to
     * components in list order, so the capped amounts still add up to the cap exactly.
     *
     * @return the capped list, or the input list itself when no cap applies
     */
    static List<ComponentTax> applyCap(List<ComponentTax> components, TaxCap cap, List<String> notes) {
        if (cap == null || cap.getMaxTaxAmount() == null) {
            return components;
        }
        BigDecimal maxTax = Amounts.nonNegative(cap.getMaxTaxAmount());
        BigDecimal calculated = sum(components);
        if (calculated.compareTo(maxTax) <= 0) {
            return components;
        }

        List<ComponentTax> capped = new ArrayList<>(components.size());
        BigDecimal remaining = maxTax;
        for (ComponentTax component : components) {
            BigDecimal amount = Amounts.min(component.getAmount(), remaining);
            remaining = remaining.subtract(amount);
            capped.add(ComponentTax.builder()
                    .label(component.getLabel())
                    .rate(component.getRate())
                    .amount(amount)
                    .build());
        }
        notes.add("Tax cap applied: calculated " + display(calculated) + " limited to " + display(maxTax));
        return capped;
    }

    /** Builds the breakdown; the credit is subtracted from the gross and the total floored at zero. */
    static TaxAmountBreakdown breakdown(List<ComponentTax> components, BigDecimal credit) {
        BigDecimal gross = sum(components);
        BigDecimal total = Amounts.nonNegative(gross.subtract(Amounts.orZero(credit)));
        return TaxAmountBreakdown.builder()
                .componentTaxes(List.copyOf(components))
                .grossTax(gross)
                .totalTax(total)
                .build();
    }

    static boolean isCapped(List<ComponentTax> before, List<ComponentTax> after) {
        return before != after;
    }
}
