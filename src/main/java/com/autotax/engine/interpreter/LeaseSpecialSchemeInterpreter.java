package com.autotax.engine.interpreter;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.LeaseSpecialScheme;
import com.autotax.domain.model.FeeLine;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.engine.Amounts;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Scheme-specific lease adjustments.
 *
 * <p>Only NJ_LUXURY produces a numeric effect: a surcharge on the cap cost above
 * {@link #NJ_LUXURY_THRESHOLD}. The other schemes are markers whose effect is already
 * in the rate components chosen upstream, so they only contribute notes.
 */
public final class LeaseSpecialSchemeInterpreter {

    public static final String NJ_LUXURY_FEE_CODE = "NJ_LUXURY_TAX";

    public static final BigDecimal NJ_LUXURY_THRESHOLD = new BigDecimal("45000");

    public static final BigDecimal NJ_LUXURY_RATE = new BigDecimal("0.004");

    private LeaseSpecialSchemeInterpreter() {}

    public static LeaseSchemeAdjustment interpret(
            LeaseSpecialScheme scheme,
            BigDecimal grossCapCost,
            BigDecimal basePayment,
            int paymentCount,
            TaxRulesConfig rules) {
        List<String> notes = new ArrayList<>();
        List<FeeLine> specialFees = new ArrayList<>();

        if (scheme == null) {
            notes.add("Lease scheme: unknown scheme, no adjustments applied");
            return LeaseSchemeAdjustment.none(notes);
        }

        switch (scheme) {
            case NONE -> notes.add("Lease scheme: standard (no special adjustments)");
            case NJ_LUXURY -> {
                notes.add("Lease scheme: NJ_LUXURY (luxury vehicle surcharge)");
                BigDecimal capCost = Amounts.orZero(grossCapCost);
                if (capCost.compareTo(NJ_LUXURY_THRESHOLD) > 0) {
                    BigDecimal fee = capCost.subtract(NJ_LUXURY_THRESHOLD).multiply(NJ_LUXURY_RATE);
                    specialFees.add(FeeLine.of(NJ_LUXURY_FEE_CODE, fee));
                    notes.add("NJ luxury surcharge: " + Amounts.displayRate(NJ_LUXURY_RATE) + " on cap cost over "
                            + display(NJ_LUXURY_THRESHOLD) + " = " + display(fee));
                }
            }
            case NY_MTR -> {
                notes.add("Lease scheme: NY_MTR (Metropolitan Commuter Transportation District)");
                notes.add("NY MCTD surcharge of 0.375% applies only through the selected local rate components");
            }
            case PA_LEASE_TAX -> notes.add("Lease scheme: PA_LEASE_TAX (tax on monthly payments, no upfront)");
            case IL_CHICAGO_COOK -> {
                notes.add("Lease scheme: IL_CHICAGO_COOK (Chicago/Cook County lease rules)");
                notes.add("IL: Chicago and Cook County lease taxes apply through the selected local rate components");
            }
            case TX_LEASE_SPECIAL -> notes.add("Lease scheme: TX_LEASE_SPECIAL (motor vehicle sales tax)");
            case VA_USAGE -> notes.add("Lease scheme: VA_USAGE (motor vehicle sales/use tax)");
            case MD_UPFRONT_GAIN -> notes.add("Lease scheme: MD_UPFRONT_GAIN (tax on upfront gain)");
            case CO_HOME_RULE_LEASE -> {
                notes.add("Lease scheme: CO_HOME_RULE_LEASE (home-rule city lease rules)");
                notes.add("CO: home-rule city rates must be supplied as rate components");
            }
            case GA_TAVT -> notes.add("Lease scheme: GA_TAVT (lease subject to Title Ad Valorem Tax)");
            default -> throw new IllegalStateException("Unhandled lease scheme: " + scheme);
        }

        return new LeaseSchemeAdjustment(BigDecimal.ZERO, BigDecimal.ZERO, List.copyOf(specialFees), notes);
    }

    /** Base adjustments and flat special fees produced by a lease scheme. */
    @Value
    public static class LeaseSchemeAdjustment {
        BigDecimal upfrontBaseAdjustment;
        BigDecimal monthlyBaseAdjustment;
        List<FeeLine> specialFees;
        List<String> notes;

        static LeaseSchemeAdjustment none(List<String> notes) {
            return new LeaseSchemeAdjustment(BigDecimal.ZERO, BigDecimal.ZERO, List.of(), notes);
        }
    }
}
