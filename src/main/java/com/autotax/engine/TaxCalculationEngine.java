package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.RebateParty;
import com.autotax.domain.enums.VehicleTaxScheme;
import com.autotax.domain.model.FeeLine;
import com.autotax.domain.model.TaxCalculationInput;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.model.TaxRulesExtras;
import com.autotax.domain.vo.ComponentTax;
import com.autotax.domain.vo.TaxAmountBreakdown;
import com.autotax.domain.vo.TaxBaseBreakdown;
import com.autotax.domain.vo.TaxCalculationResult;
import com.autotax.domain.vo.TaxDebug;
import com.autotax.engine.ReciprocityCreditCalculator.ReciprocityOutcome;
import com.autotax.engine.interpreter.DocFeeTaxabilityInterpreter;
import com.autotax.engine.interpreter.FeeTaxabilityInterpreter;
import com.autotax.engine.interpreter.RebateTaxabilityInterpreter;
import com.autotax.engine.interpreter.TradeInPolicyInterpreter;
import com.autotax.engine.interpreter.VehicleTaxSchemeInterpreter;
import com.autotax.engine.interpreter.VehicleTaxSchemeInterpreter.SchemeRates;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes sales/use tax for one vehicle deal from the deal figures and the rules of a
 * single jurisdiction.
 *
 * <p>The calculation is a pure function of {@code (input, rules)}: no I/O, no clock, no
 * shared mutable state, so one instance serves any number of threads. It never throws
 * for configuration gaps (unknown fee codes, unmatched rebate rules, unknown scheme tags);
 * each such gap falls back to the most conservative behavior and is recorded in
 * {@link TaxDebug#getNotes()}.
 *
 * <p>Retail flow:
 * <ol>
 *   <li>trade-in credit and rebate taxability reduce the vehicle base, clamped at zero</li>
 *   <li>taxable doc fee and listed fees form the fees base; taxable products the products base</li>
 *   <li>the vehicle tax scheme selects the effective rate components</li>
 *   <li>each component taxes the total base; the dollar cap and reciprocity credit follow</li>
 * </ol>
 * Lease deals share steps 3 and 4 but split the base between signing and the payment
 * stream, see {@link LeaseTaxCalculator}. Titling taxes (TAVT, highway use tax, privilege
 * tax) with configured parameters replace the whole flow, see {@link TitlingTaxResults}.
 */
@Component
public class TaxCalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(TaxCalculationEngine.class);

    public TaxCalculationResult calculateTax(TaxCalculationInput deal, TaxRulesConfig rules) {
        List<String> notes = new ArrayList<>();
        TaxCalculationInput input = normalize(deal, notes);

        TaxCalculationResult result = calculateTitlingTax(input, rules, notes);
        if (result == null) {
            SchemeRates schemeRates =
                    VehicleTaxSchemeInterpreter.interpret(rules.getVehicleTaxScheme(), input.getRates(), rules);
            result = input.getDealType() == DealType.LEASE
                    ? LeaseTaxCalculator.calculate(input, rules, schemeRates, notes)
                    : calculateRetail(input, rules, schemeRates, notes);
        }

        log.debug(
                "Calculated {} tax for {}: base={}, tax={}, notes={}",
                result.getMode(),
                rules.getStateCode(),
                result.getBases().getTotalTaxableBase(),
                result.getTaxes().getTotalTax(),
                result.getDebug().getNotes().size());
        return result;
    }

    /**
     * Fills the gaps a deserialized deal can carry: an explicit null deal type becomes
     * RETAIL, null lists become empty and null list entries are dropped.
     */
    static TaxCalculationInput normalize(TaxCalculationInput deal, List<String> notes) {
        TaxCalculationInput.TaxCalculationInputBuilder normalized = deal.toBuilder();
        if (deal.getDealType() == null) {
            notes.add("WARNING: Deal type unknown; taxing as RETAIL");
            normalized.dealType(DealType.RETAIL);
        }
        normalized.otherFees(withoutNulls(deal.getOtherFees(), "fee", notes));
        normalized.rates(withoutNulls(deal.getRates(), "rate component", notes));
        return normalized.build();
    }

    private static <T> List<T> withoutNulls(List<T> items, String kind, List<String> notes) {
        if (items == null) {
            return List.of();
        }
        List<T> present = items.stream().filter(Objects::nonNull).collect(Collectors.toList());
        int dropped = items.size() - present.size();
        if (dropped > 0) {
            notes.add("WARNING: " + dropped + " empty " + kind + " entries ignored");
        }
        return List.copyOf(present);
    }

    /**
     * Titling-tax schemes with configured parameters get their own base rules. Without the
     * parameter block the scheme passes the rate list through like a sales tax.
     *
     * @return null when the deal is taxed by the sales-tax flow
     */
    private TaxCalculationResult calculateTitlingTax(
            TaxCalculationInput input, TaxRulesConfig rules, List<String> notes) {
        VehicleTaxScheme scheme = rules.getVehicleTaxScheme();
        if (scheme == null) {
            return null;
        }
        TaxRulesExtras extras = rules.getExtras();
        switch (scheme) {
            case SPECIAL_TAVT -> {
                if (extras != null && extras.getTavt() != null) {
                    return TitleAdValoremTaxCalculator.calculate(input, rules, extras.getTavt(), notes);
                }
            }
            case SPECIAL_HUT -> {
                if (extras != null && extras.getHighwayUseTax() != null) {
                    return HighwayUseTaxCalculator.calculate(input, rules, extras.getHighwayUseTax(), notes);
                }
            }
            case DMV_PRIVILEGE_TAX -> {
                if (extras != null && extras.getPrivilegeTax() != null) {
                    return PrivilegeTaxCalculator.calculate(input, rules, extras.getPrivilegeTax(), notes);
                }
            }
            default -> {
                return null;
            }
        }
        notes.add("No " + scheme + " parameters configured for " + rules.getStateCode()
                + "; taxed on the sales-tax base");
        return null;
    }

    private TaxCalculationResult calculateRetail(
            TaxCalculationInput input, TaxRulesConfig rules, SchemeRates schemeRates, List<String> notes) {
        BigDecimal vehiclePrice = Amounts.orZero(input.getVehiclePrice());

        // Vehicle base
        BigDecimal appliedTradeIn =
                TradeInPolicyInterpreter.interpret(rules.getTradeInPolicy(), input.getTradeInValue(), vehiclePrice, notes);

        BigDecimal rebatesTaxable = BigDecimal.ZERO;
        BigDecimal rebatesNonTaxable = BigDecimal.ZERO;
        for (RebateParty party : RebateParty.values()) {
            BigDecimal amount = Amounts.nonNegative(rebateAmount(input, party));
            if (amount.signum() == 0) {
                continue;
            }
            if (RebateTaxabilityInterpreter.findRule(party, rules.getRebates()).isEmpty()) {
                notes.add("WARNING: No rebate rule for " + party + " rebate; treated as non-taxable");
            }
            if (RebateTaxabilityInterpreter.isRebateTaxable(party, rules.getRebates())) {
                rebatesTaxable = rebatesTaxable.add(amount);
                notes.add(party + " rebate " + display(amount) + " is taxable (does not reduce the base)");
            } else {
                rebatesNonTaxable = rebatesNonTaxable.add(amount);
                notes.add(party + " rebate " + display(amount) + " is non-taxable (reduces the base)");
            }
        }

        BigDecimal subtotal = vehiclePrice;
        if (rules.isTaxOnAccessories()) {
            subtotal = subtotal.add(Amounts.orZero(input.getAccessoriesAmount()));
        } else if (Amounts.isPositive(input.getAccessoriesAmount())) {
            notes.add("Accessories " + display(input.getAccessoriesAmount()) + " excluded from the taxable base");
        }
        if (rules.isTaxOnNegativeEquity()) {
            subtotal = subtotal.add(Amounts.orZero(input.getNegativeEquity()));
        } else if (Amounts.isPositive(input.getNegativeEquity())) {
            notes.add("Negative equity " + display(input.getNegativeEquity()) + " excluded from the taxable base");
        }
        BigDecimal reduced = subtotal.subtract(appliedTradeIn).subtract(rebatesNonTaxable);
        BigDecimal vehicleBase = Amounts.nonNegative(reduced);
        if (reduced.signum() < 0) {
            notes.add("Trade-in and rebates exceed the vehicle subtotal " + display(subtotal)
                    + "; vehicle base clamped to $0.00");
        }

        // Fees base
        BigDecimal taxableDocFee = BigDecimal.ZERO;
        if (Amounts.isPositive(input.getDocFee())) {
            if (DocFeeTaxabilityInterpreter.isDocFeeTaxable(DealType.RETAIL, rules)) {
                taxableDocFee = input.getDocFee();
            } else {
                notes.add("Doc fee " + display(input.getDocFee()) + " is not taxable");
            }
        }
        List<FeeLine> taxableFees = new ArrayList<>();
        BigDecimal feesBase = taxableDocFee;
        for (FeeLine fee : input.getOtherFees()) {
            if (!FeeTaxabilityInterpreter.isKnownFee(fee.getCode(), DealType.RETAIL, rules)) {
                notes.add("WARNING: Unknown fee code " + fee.getCode() + " excluded from the taxable base");
            } else if (FeeTaxabilityInterpreter.isFeeTaxable(fee.getCode(), DealType.RETAIL, rules)) {
                taxableFees.add(fee);
                feesBase = feesBase.add(Amounts.orZero(fee.getAmount()));
            } else {
                notes.add("Fee " + fee.getCode() + " is not taxable");
            }
        }

        // Products base
        BigDecimal taxableServiceContracts = BigDecimal.ZERO;
        if (Amounts.isPositive(input.getServiceContracts())) {
            if (rules.isTaxOnServiceContracts()) {
                taxableServiceContracts = input.getServiceContracts();
            } else {
                notes.add("Service contracts " + display(input.getServiceContracts()) + " are not taxable");
            }
        }
        BigDecimal taxableGap = BigDecimal.ZERO;
        if (Amounts.isPositive(input.getGap())) {
            if (rules.isTaxOnGap()) {
                taxableGap = input.getGap();
            } else {
                notes.add("GAP " + display(input.getGap()) + " is not taxable");
            }
        }

        TaxBaseBreakdown bases =
                TaxBaseBreakdown.of(vehicleBase, feesBase, taxableServiceContracts.add(taxableGap));

        // Taxes
        notes.addAll(schemeRates.getNotes());
        List<ComponentTax> calculated =
                ComponentTaxCalculator.applyRates(bases.getTotalTaxableBase(), schemeRates.getEffectiveRates());
        List<ComponentTax> components = ComponentTaxCalculator.applyCap(calculated, rules.getTaxCap(), notes);

        ReciprocityOutcome reciprocity = ReciprocityCreditCalculator.calculate(
                input, rules.getReciprocity(), ComponentTaxCalculator.sum(components));
        notes.addAll(reciprocity.getNotes());
        TaxAmountBreakdown taxes = ComponentTaxCalculator.breakdown(components, reciprocity.getCredit());

        TaxDebug debug = TaxDebug.builder()
                .appliedTradeIn(appliedTradeIn)
                .appliedRebatesTaxable(rebatesTaxable)
                .appliedRebatesNonTaxable(rebatesNonTaxable)
                .taxableDocFee(taxableDocFee)
                .taxableFees(List.copyOf(taxableFees))
                .taxableServiceContracts(taxableServiceContracts)
                .taxableGap(taxableGap)
                .reciprocityCredit(reciprocity.getCredit())
                .taxCapApplied(ComponentTaxCalculator.isCapped(calculated, components))
                .notes(List.copyOf(notes))
                .build();

        return TaxCalculationResult.builder()
                .mode(DealType.RETAIL)
                .bases(bases)
                .taxes(taxes)
                .debug(debug)
                .build();
    }

    static BigDecimal rebateAmount(TaxCalculationInput input, RebateParty party) {
        return party == RebateParty.MANUFACTURER ? input.getRebateManufacturer() : input.getRebateDealer();
    }
}
