package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.LeaseMethod;
import com.autotax.domain.enums.LeaseRebateBehavior;
import com.autotax.domain.enums.LeaseSpecialScheme;
import com.autotax.domain.enums.LeaseTradeInCredit;
import com.autotax.domain.enums.RebateParty;
import com.autotax.domain.model.FeeLine;
import com.autotax.domain.model.LeaseRules;
import com.autotax.domain.model.LeaseTerms;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.LeaseTaxBreakdown;
import com.autotax.domain.vo.TaxAmountBreakdown;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import com.autotax.engine.ReciprocityCreditCalculator.ReciprocityOutcome;
import com.autotax.engine.interpreter.DocFeeTaxabilityInterpreter;
import com.autotax.engine.interpreter.FeeTaxabilityInterpreter;
import com.autotax.engine.interpreter.LeaseSpecialSchemeInterpreter;
import com.autotax.engine.interpreter.LeaseSpecialSchemeInterpreter.LeaseSchemeAdjustment;
import com.autotax.engine.interpreter.RebateTaxabilityInterpreter;
import com.autotax.engine.interpreter.TradeInPolicyInterpreter;
import com.autotax.engine.interpreter.VehicleTaxSchemeInterpreter.SchemeRates;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Lease side of the engine. Produces the same bases as a retail deal (measured on the
 * capitalized cost) and splits the tax between signing and each periodic payment
 * according to the jurisdiction's lease method:
 *
 * <ul>
 *   <li><b>MONTHLY:</b> upfront = taxable fees (when taxed upfront) + taxable cap reduction
 *       (when cap reductions are taxed); per period = base payment</li>
 *   <li><b>FULL_UPFRONT:</b> upfront = lease vehicle base + fees + products; nothing per period</li>
 *   <li><b>HYBRID:</b> upfront = fees + products + taxable cap reduction; per period = base payment</li>
 * </ul>
 *
 * <p>Taxable cap reduction is the cash down payment plus any rebate treated as taxable.
 * The tax cap and reciprocity credit apply to the tax due at signing only.
 */
final class LeaseTaxCalculator {

    private LeaseTaxCalculator() {}

    static TaxCalculationResult calculate(
            TaxCalculationInput input, TaxRulesConfig rules, SchemeRates schemeRates, List<String> notes) {
        LeaseRules leaseRules = rules.getLeaseRules();
        if (leaseRules == null) {
            notes.add("WARNING: No lease rules for " + rules.getStateCode()
                    + "; taxing as MONTHLY with no lease fee rules");
            leaseRules = LeaseRules.builder().method(LeaseMethod.MONTHLY).build();
        }
        LeaseTerms terms = resolveTerms(input, notes);
        BigDecimal grossCapCost = terms.getGrossCapCost();

        // Cap cost reductions
        BigDecimal tradeIn = Amounts.isPositive(terms.getCapReductionTradeIn())
                ? terms.getCapReductionTradeIn()
                : Amounts.nonNegative(input.getTradeInValue());
        BigDecimal appliedTradeIn = leaseTradeInCredit(leaseRules.getTradeInCredit(), tradeIn, grossCapCost, rules, notes);

        BigDecimal rebatesTaxable = BigDecimal.ZERO;
        BigDecimal rebatesNonTaxable = BigDecimal.ZERO;
        for (RebateParty party : RebateParty.values()) {
            BigDecimal amount = Amounts.nonNegative(leaseRebateAmount(input, terms, party));
            if (amount.signum() == 0) {
                continue;
            }
            if (isLeaseRebateTaxable(leaseRules.getRebateBehavior(), party, rules, notes)) {
                rebatesTaxable = rebatesTaxable.add(amount);
                notes.add(party + " rebate " + display(amount) + " on lease is taxable");
            } else {
                rebatesNonTaxable = rebatesNonTaxable.add(amount);
                notes.add(party + " rebate " + display(amount) + " on lease is non-taxable (reduces the base)");
            }
        }

        BigDecimal capCost = grossCapCost;
        if (leaseRules.isNegativeEquityTaxable()) {
            capCost = capCost.add(Amounts.orZero(input.getNegativeEquity()));
        } else if (Amounts.isPositive(input.getNegativeEquity())) {
            notes.add("Negative equity " + display(input.getNegativeEquity()) + " on lease is not taxable");
        }
        BigDecimal reduced = capCost.subtract(appliedTradeIn).subtract(rebatesNonTaxable);
        BigDecimal vehicleBase = Amounts.nonNegative(reduced);
        if (reduced.signum() < 0) {
            notes.add("Lease cap cost reductions exceed " + display(capCost) + "; lease base clamped to $0.00");
        }

        // Fees, split by when they are taxed
        BigDecimal taxableDocFee = BigDecimal.ZERO;
        if (Amounts.isPositive(input.getDocFee())) {
            if (DocFeeTaxabilityInterpreter.isDocFeeTaxable(DealType.LEASE, rules)) {
                taxableDocFee = input.getDocFee();
            } else {
                notes.add("Doc fee " + display(input.getDocFee()) + " is not taxable on leases");
            }
        }
        List<FeeLine> taxableFees = new ArrayList<>();
        BigDecimal upfrontFees = BigDecimal.ZERO;
        BigDecimal capitalizedFees = BigDecimal.ZERO;
        for (FeeLine fee : input.getOtherFees()) {
            String code = fee.getCode();
            if (!FeeTaxabilityInterpreter.isKnownFee(code, DealType.LEASE, rules)) {
                notes.add("WARNING: Unknown fee code " + code + " excluded from the lease taxable base");
            } else if (!FeeTaxabilityInterpreter.isLeaseFeeTaxable(code, leaseRules)) {
                notes.add("Fee " + code + " is not taxable on leases");
            } else {
                taxableFees.add(fee);
                BigDecimal amount = Amounts.orZero(fee.getAmount());
                if (FeeTaxabilityInterpreter.isLeaseFeeTaxedUpfront(code, leaseRules)) {
                    upfrontFees = upfrontFees.add(amount);
                } else {
                    capitalizedFees = capitalizedFees.add(amount);
                    notes.add("Fee " + code + " is taxed through the payment, not at signing");
                }
            }
        }
        BigDecimal feesBase = taxableDocFee.add(upfrontFees).add(capitalizedFees);

        // Products
        BigDecimal taxableServiceContracts = leaseProduct(
                input.getServiceContracts(), FeeTaxabilityInterpreter.SERVICE_CONTRACT, leaseRules, notes);
        BigDecimal taxableGap = leaseProduct(input.getGap(), FeeTaxabilityInterpreter.GAP, leaseRules, notes);
        BigDecimal productsBase = taxableServiceContracts.add(taxableGap);

        TaxBaseBreakdown bases = TaxBaseBreakdown.of(vehicleBase, feesBase, productsBase);

        // Scheme adjustments
        notes.addAll(schemeRates.getNotes());
        LeaseSpecialScheme specialScheme = leaseRules.getSpecialScheme();
        LeaseSchemeAdjustment adjustment = LeaseSpecialSchemeInterpreter.interpret(
                specialScheme, grossCapCost, terms.getBasePayment(), terms.getPaymentCount(), rules);
        notes.addAll(adjustment.getNotes());

        // Upfront / periodic split
        BigDecimal cashDown = Amounts.nonNegative(terms.getCapReductionCash());
        BigDecimal taxableCapReduction = cashDown.add(rebatesTaxable);
        BigDecimal basePayment = Amounts.nonNegative(terms.getBasePayment());
        boolean docFeeUpfrontOnly = DocFeeTaxabilityInterpreter.isDocFeeUpfrontOnly(rules);

        LeaseMethod method = leaseRules.getMethod();
        if (method == null) {
            notes.add("WARNING: Lease method unknown; taxing as MONTHLY");
            method = LeaseMethod.MONTHLY;
        }
        BigDecimal upfrontBase;
        BigDecimal periodicBase;
        switch (method) {
            case MONTHLY -> {
                upfrontBase = BigDecimal.ZERO;
                if (leaseRules.isTaxFeesUpfront()) {
                    upfrontBase = upfrontBase.add(taxableDocFee).add(upfrontFees);
                } else {
                    if (docFeeUpfrontOnly) {
                        upfrontBase = upfrontBase.add(taxableDocFee);
                    }
                    if (upfrontFees.signum() > 0) {
                        notes.add("Taxable lease fees " + display(upfrontFees) + " are taxed through the payment");
                    }
                }
                if (leaseRules.isTaxCapReduction()) {
                    upfrontBase = upfrontBase.add(taxableCapReduction);
                    if (taxableCapReduction.signum() > 0) {
                        notes.add("Cap cost reduction " + display(taxableCapReduction) + " taxed at signing");
                    }
                }
                periodicBase = basePayment.add(adjustment.getMonthlyBaseAdjustment());
                notes.add("Lease method: MONTHLY (tax on each payment of " + display(periodicBase) + ")");
            }
            case FULL_UPFRONT -> {
                upfrontBase = vehicleBase.add(feesBase).add(productsBase);
                periodicBase = BigDecimal.ZERO;
                notes.add("Lease method: FULL_UPFRONT (entire lease base taxed at signing)");
            }
            case HYBRID -> {
                upfrontBase = taxableDocFee.add(upfrontFees).add(productsBase).add(taxableCapReduction);
                periodicBase = basePayment.add(adjustment.getMonthlyBaseAdjustment());
                notes.add("Lease method: HYBRID (fees, products and cap reduction at signing, tax on each payment)");
            }
            default -> throw new IllegalStateException("Unhandled lease method: " + method);
        }
        upfrontBase = Amounts.nonNegative(upfrontBase.add(adjustment.getUpfrontBaseAdjustment()));
        periodicBase = Amounts.nonNegative(periodicBase);

        // Upfront taxes: rate components, cap, special fees, credit
        List<ComponentTax> calculated =
                ComponentTaxCalculator.applyRates(upfrontBase, schemeRates.getEffectiveRates());
        List<ComponentTax> capped = ComponentTaxCalculator.applyCap(calculated, rules.getTaxCap(), notes);
        List<ComponentTax> upfrontComponents = new ArrayList<>(capped);
        upfrontComponents.addAll(ComponentTaxCalculator.flatFees(adjustment.getSpecialFees()));

        ReciprocityOutcome reciprocity = ReciprocityCreditCalculator.calculate(
                input, rules.getReciprocity(), ComponentTaxCalculator.sum(upfrontComponents));
        notes.addAll(reciprocity.getNotes());
        TaxAmountBreakdown upfrontTaxes = ComponentTaxCalculator.breakdown(upfrontComponents, reciprocity.getCredit());

        TaxAmountBreakdown periodicTaxes = ComponentTaxCalculator.breakdown(
                ComponentTaxCalculator.applyRates(periodicBase, schemeRates.getEffectiveRates()), BigDecimal.ZERO);

        int paymentCount = Math.max(0, terms.getPaymentCount());
        BigDecimal totalOverTerm =
                upfrontTaxes.getTotalTax().add(periodicTaxes.getTotalTax().multiply(BigDecimal.valueOf(paymentCount)));

        LeaseTaxBreakdown leaseBreakdown = LeaseTaxBreakdown.builder()
                .upfrontTaxableBase(upfrontBase)
                .upfrontTaxes(upfrontTaxes)
                .paymentTaxableBasePerPeriod(periodicBase)
                .paymentTaxesPerPeriod(periodicTaxes)
                .paymentCount(paymentCount)
                .totalTaxOverTerm(totalOverTerm)
                .build();

        TaxDebug debug = TaxDebug.builder()
                .appliedTradeIn(appliedTradeIn)
                .appliedRebatesTaxable(rebatesTaxable)
                .appliedRebatesNonTaxable(rebatesNonTaxable)
                .taxableDocFee(taxableDocFee)
                .taxableFees(List.copyOf(taxableFees))
                .taxableServiceContracts(taxableServiceContracts)
                .taxableGap(taxableGap)
                .reciprocityCredit(reciprocity.getCredit())
                .taxCapApplied(ComponentTaxCalculator.isCapped(calculated, capped))
                .notes(List.copyOf(notes))
                .build();

        return TaxCalculationResult.builder()
                .mode(DealType.LEASE)
                .bases(bases)
                .taxes(upfrontTaxes)
                .leaseBreakdown(leaseBreakdown)
                .debug(debug)
                .build();
    }

    private static LeaseTerms resolveTerms(TaxCalculationInput input, List<String> notes) {
        LeaseTerms terms = input.getLeaseTerms();
        if (terms == null) {
            notes.add("WARNING: Lease deal without lease terms; cap cost taken from the vehicle price, no payments");
            return LeaseTerms.builder()
                    .grossCapCost(Amounts.nonNegative(input.getVehiclePrice()))
                    .build();
        }
        if (!Amounts.isPositive(terms.getGrossCapCost())) {
            notes.add("Gross cap cost missing; using vehicle price " + display(input.getVehiclePrice()));
            return terms.toBuilder()
                    .grossCapCost(Amounts.nonNegative(input.getVehiclePrice()))
                    .build();
        }
        return terms;
    }

    private static BigDecimal leaseTradeInCredit(
            LeaseTradeInCredit credit,
            BigDecimal tradeIn,
            BigDecimal grossCapCost,
            TaxRulesConfig rules,
            List<String> notes) {
        if (tradeIn.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (credit == null) {
            notes.add("WARNING: Lease trade-in treatment unknown; following the retail trade-in policy");
            return TradeInPolicyInterpreter.interpret(rules.getTradeInPolicy(), tradeIn, grossCapCost, notes);
        }
        return switch (credit) {
            case NONE -> {
                notes.add("Lease trade-in: no credit against the lease base");
                yield BigDecimal.ZERO;
            }
            case FULL, CAP_COST_ONLY -> {
                notes.add("Lease trade-in: " + display(tradeIn) + " reduces the capitalized cost");
                yield tradeIn;
            }
            case APPLIED_TO_PAYMENT -> {
                notes.add("Lease trade-in: " + display(tradeIn) + " applied to payments; lease base unchanged");
                yield BigDecimal.ZERO;
            }
            case FOLLOW_RETAIL_RULE ->
                TradeInPolicyInterpreter.interpret(rules.getTradeInPolicy(), tradeIn, grossCapCost, notes);
        };
    }

    private static boolean isLeaseRebateTaxable(
            LeaseRebateBehavior behavior, RebateParty party, TaxRulesConfig rules, List<String> notes) {
        if (behavior == null) {
            notes.add("WARNING: Lease rebate behavior unknown; following the retail rebate rules");
            return RebateTaxabilityInterpreter.isRebateTaxable(party, rules.getRebates());
        }
        return switch (behavior) {
            case ALWAYS_TAXABLE -> true;
            case ALWAYS_NON_TAXABLE -> false;
            case FOLLOW_RETAIL_RULE -> RebateTaxabilityInterpreter.isRebateTaxable(party, rules.getRebates());
        };
    }

    private static BigDecimal leaseRebateAmount(TaxCalculationInput input, LeaseTerms terms, RebateParty party) {
        BigDecimal capReduction = party == RebateParty.MANUFACTURER
                ? terms.getCapReductionRebateManufacturer()
                : terms.getCapReductionRebateDealer();
        return Amounts.isPositive(capReduction) ? capReduction : TaxCalculationEngine.rebateAmount(input, party);
    }

    private static BigDecimal leaseProduct(BigDecimal amount, String code, LeaseRules leaseRules, List<String> notes) {
        if (!Amounts.isPositive(amount)) {
            return BigDecimal.ZERO;
        }
        if (FeeTaxabilityInterpreter.isLeaseFeeTaxable(code, leaseRules)) {
            return amount;
        }
        notes.add(code + " " + display(amount) + " is not taxable on leases");
        return BigDecimal.ZERO;
    }
}
