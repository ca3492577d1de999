package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.model.FeeLine;
import com.autotax.domain.model.LeaseTerms;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.LeaseTaxBreakdown;
import com.autotax.domain.vo.TaxAmountBreakdown;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import com.autotax.engine.ReciprocityCreditCalculator.ReciprocityOutcome;
import com.autotax.engine.interpreter.FeeTaxabilityInterpreter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Steps shared by the titling-tax calculators (TAVT, highway use tax, privilege tax).
 *
 * <p>A titling tax is one component at one rate, collected once when the vehicle is titled.
 * Leases therefore carry the whole tax at signing and nothing per payment. The jurisdiction's
 * dollar cap and reciprocity rules apply as they do for sales tax.
 */
final class TitlingTaxResults {

    private TitlingTaxResults() {}

    /**
     * The scheme's single rate component, labeled {@code <STATE>_<suffix>}. A missing rate
     * falls back to the deal's STATE component (zero without one).
     */
    static TaxRateComponent schemeRate(
            TaxRulesConfig rules, String suffix, BigDecimal configured, TaxCalculationInput input, List<String> notes) {
        String label = rules.getStateCode() != null ? rules.getStateCode() + "_" + suffix : suffix;
        if (configured != null) {
            return TaxRateComponent.of(label, configured);
        }
        BigDecimal stateRate = input.getRates().stream()
                .filter(TaxRateComponent::isState)
                .map(component -> Amounts.orZero(component.getRate()))
                .findFirst()
                .orElse(BigDecimal.ZERO);
        notes.add("WARNING: No " + suffix + " rate configured; using the STATE rate " + Amounts.displayRate(stateRate));
        return TaxRateComponent.of(label, stateRate);
    }

    /** Gross cap cost of a lease, or the vehicle price when the lease has none. */
    static BigDecimal leaseCapCost(TaxCalculationInput input) {
        LeaseTerms terms = input.getLeaseTerms();
        if (terms != null && Amounts.isPositive(terms.getGrossCapCost())) {
            return terms.getGrossCapCost();
        }
        return Amounts.nonNegative(input.getVehiclePrice());
    }

    /** The higher of {@code base} and the deal's assessed value. */
    static BigDecimal higherOfAssessed(BigDecimal base, TaxCalculationInput input, String scheme, List<String> notes) {
        BigDecimal assessed = input.getAssessedValue();
        if (Amounts.isPositive(assessed) && assessed.compareTo(base) > 0) {
            notes.add(scheme + ": assessed value " + display(assessed) + " exceeds the price " + display(base)
                    + " and is used as the base");
            return assessed;
        }
        return base;
    }

    /**
     * Doc fee, listed fees and F&I products taxed alongside the vehicle, following the
     * jurisdiction's retail taxability rules.
     */
    static AddOns addOns(TaxCalculationInput input, TaxRulesConfig rules, String scheme, List<String> notes) {
        BigDecimal taxableDocFee = BigDecimal.ZERO;
        if (Amounts.isPositive(input.getDocFee())) {
            if (rules.isDocFeeTaxable()) {
                taxableDocFee = input.getDocFee();
            } else {
                notes.add(scheme + ": doc fee " + display(input.getDocFee()) + " is not taxable");
            }
        }
        List<FeeLine> taxableFees = new ArrayList<>();
        BigDecimal feesBase = taxableDocFee;
        for (FeeLine fee : input.getOtherFees()) {
            if (FeeTaxabilityInterpreter.isFeeTaxable(fee.getCode(), DealType.RETAIL, rules)) {
                taxableFees.add(fee);
                feesBase = feesBase.add(Amounts.orZero(fee.getAmount()));
            } else {
                notes.add(scheme + ": fee " + fee.getCode() + " is not taxable");
            }
        }
        BigDecimal serviceContracts = product(
                input.getServiceContracts(), rules.isTaxOnServiceContracts(), "service contracts", scheme, notes);
        BigDecimal gap = product(input.getGap(), rules.isTaxOnGap(), "GAP", scheme, notes);
        return new AddOns(taxableDocFee, List.copyOf(taxableFees), feesBase, serviceContracts, gap);
    }

    private static BigDecimal product(
            BigDecimal amount, boolean taxable, String name, String scheme, List<String> notes) {
        if (!Amounts.isPositive(amount)) {
            return BigDecimal.ZERO;
        }
        if (taxable) {
            return amount;
        }
        notes.add(scheme + ": " + name + " " + display(amount) + " are not taxable");
        return BigDecimal.ZERO;
    }

    /**
     * Taxes the total base at {@code rate}, applies the cap and the reciprocity credit, and
     * shapes the result for the deal type.
     *
     * @param reciprocityWindowDays scheme-level limit on the age of tax paid elsewhere; null for none
     * @param debug                 pre-filled with the scheme's base decisions
     */
    static TaxCalculationResult assemble(
            TaxCalculationInput input,
            TaxRulesConfig rules,
            TaxRateComponent rate,
            TaxBaseBreakdown bases,
            Integer reciprocityWindowDays,
            TaxDebug.TaxDebugBuilder debug,
            List<String> notes) {
        List<ComponentTax> calculated =
                ComponentTaxCalculator.applyRates(bases.getTotalTaxableBase(), List.of(rate));
        List<ComponentTax> components = ComponentTaxCalculator.applyCap(calculated, rules.getTaxCap(), notes);

        ReciprocityOutcome reciprocity;
        if (reciprocityWindowDays != null
                && Amounts.isPositive(input.getTaxAlreadyCollected())
                && !ReciprocityCreditCalculator.withinWindow(input, reciprocityWindowDays, notes)) {
            reciprocity = ReciprocityOutcome.denied(List.of(), false);
        } else {
            reciprocity = ReciprocityCreditCalculator.calculate(
                    input, rules.getReciprocity(), ComponentTaxCalculator.sum(components));
        }
        notes.addAll(reciprocity.getNotes());
        TaxAmountBreakdown taxes = ComponentTaxCalculator.breakdown(components, reciprocity.getCredit());

        debug.reciprocityCredit(reciprocity.getCredit())
                .taxCapApplied(ComponentTaxCalculator.isCapped(calculated, components))
                .notes(List.copyOf(notes));

        TaxCalculationResult.TaxCalculationResultBuilder result = TaxCalculationResult.builder()
                .mode(input.getDealType())
                .bases(bases)
                .taxes(taxes)
                .debug(debug.build());
        if (input.getDealType() == DealType.LEASE) {
            int paymentCount = input.getLeaseTerms() != null ? Math.max(0, input.getLeaseTerms().getPaymentCount()) : 0;
            result.leaseBreakdown(LeaseTaxBreakdown.builder()
                    .upfrontTaxableBase(bases.getTotalTaxableBase())
                    .upfrontTaxes(taxes)
                    .paymentTaxableBasePerPeriod(BigDecimal.ZERO)
                    .paymentTaxesPerPeriod(ComponentTaxCalculator.breakdown(List.of(), BigDecimal.ZERO))
                    .paymentCount(paymentCount)
                    .totalTaxOverTerm(taxes.getTotalTax())
                    .build());
        }
        return result.build();
    }

    /** Fees and products that join the vehicle in a titling-tax base. */
    @Value
    static class AddOns {
        BigDecimal taxableDocFee;
        List<FeeLine> taxableFees;
        BigDecimal feesBase;
        BigDecimal taxableServiceContracts;
        BigDecimal taxableGap;

        BigDecimal productsBase() {
            return taxableServiceContracts.add(taxableGap);
        }
    }
}
