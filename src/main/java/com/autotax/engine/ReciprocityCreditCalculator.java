package com.autotax.engine;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.ReciprocityBehavior;
import com.autotax.domain.enums.ReciprocityBasis;
import com.autotax.domain.enums.VehicleClass;
import com.autotax.domain.model.ReciprocityOverride;
import com.autotax.domain.model.ReciprocityRules;
import com.autotax.domain.model.TaxCalculationInput;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Value;

/**
 * Credit for sales/use tax already paid to another jurisdiction on the same vehicle.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>reciprocity disabled, deal type out of scope, lease exception, nothing collected: no credit</li>
 *   <li>an override matching the origin state (then the {@code ALL} override), restricted to the
 *       deal's vehicle class and weight, may deny the credit, replace the behavior and the cap
 *       flag, or add a time window, a mutual-credit or a same-owner condition</li>
 *   <li>the behavior computes the credit, capped at this jurisdiction's tax when the cap flag is set</li>
 * </ol>
 * Time windows are measured from {@code originTaxPaidDate} to {@code asOfDate} on the input.
 */
public final class ReciprocityCreditCalculator {

    private ReciprocityCreditCalculator() {}

    /**
     * @param input  the deal, supplying the tax already collected and the origin fields
     * @param rules  reciprocity rules of this jurisdiction (may be null)
     * @param taxDue tax owed here before any credit
     */
    public static ReciprocityOutcome calculate(TaxCalculationInput input, ReciprocityRules rules, BigDecimal taxDue) {
        List<String> notes = new ArrayList<>();
        BigDecimal collected = Amounts.orZero(input.getTaxAlreadyCollected());

        if (rules == null || !rules.isEnabled()) {
            if (collected.signum() > 0) {
                notes.add("Reciprocity: not offered by this jurisdiction; " + display(collected)
                        + " paid elsewhere is not credited");
            }
            return ReciprocityOutcome.denied(notes, false);
        }
        if (collected.signum() <= 0) {
            return ReciprocityOutcome.denied(notes, false);
        }
        DealType dealType = input.getDealType() != null ? input.getDealType() : DealType.RETAIL;
        if (rules.getScope() == null || !rules.getScope().covers(dealType)) {
            notes.add("Reciprocity: " + dealType + " deals are outside the reciprocity scope ("
                    + rules.getScope() + ")");
            return ReciprocityOutcome.denied(notes, false);
        }
        if (dealType == DealType.LEASE && rules.isHasLeaseException()) {
            notes.add("Reciprocity: lease exception applies; no credit for tax paid elsewhere on leases");
            return ReciprocityOutcome.denied(notes, false);
        }

        ReciprocityBehavior behavior = rules.getHomeStateBehavior();
        boolean capAtThisStatesTax = rules.isCapAtThisStatesTax();
        Optional<ReciprocityOverride> override = findOverride(input, rules.getOverrides());
        if (override.isPresent()) {
            ReciprocityOverride matched = override.get();
            notes.add("Reciprocity override applied for origin " + matched.getOriginState()
                    + (matched.getNotes() != null ? ": " + matched.getNotes() : ""));
            if (matched.isDisallowCredit()) {
                notes.add("Reciprocity: credit disallowed for origin " + matched.getOriginState());
                return ReciprocityOutcome.denied(notes, true);
            }
            if (matched.getBehavior() != null) {
                behavior = matched.getBehavior();
            }
            if (matched.getCapAtThisStatesTax() != null) {
                capAtThisStatesTax = matched.getCapAtThisStatesTax();
            }
            if (matched.getMaxAgeDaysSinceTaxPaid() != null
                    && !withinWindow(input, matched.getMaxAgeDaysSinceTaxPaid(), notes)) {
                return ReciprocityOutcome.denied(notes, true);
            }
            if (matched.isRequiresMutualCredit()
                    && !hasMutualCredit(input.getOriginState(), rules.getOverrides(), notes)) {
                return ReciprocityOutcome.denied(notes, true);
            }
            if (matched.isRequiresSameOwner() && !Boolean.TRUE.equals(input.getOriginSameOwner())) {
                notes.add("Reciprocity: credit requires the same owner as when tax was paid in "
                        + input.getOriginState() + "; no credit applied");
                return ReciprocityOutcome.denied(notes, true);
            }
        }

        if (rules.isRequireProofOfTaxPaid()) {
            notes.add("Reciprocity: proof of tax paid to the origin jurisdiction is required");
        }
        if (rules.getBasis() != null && rules.getBasis() != ReciprocityBasis.TAX_PAID) {
            notes.add("Reciprocity: unsupported credit basis " + rules.getBasis() + "; no credit applied");
            return ReciprocityOutcome.denied(notes, override.isPresent());
        }
        if (behavior == null) {
            notes.add("WARNING: Reciprocity behavior unknown; no credit applied");
            return ReciprocityOutcome.denied(notes, override.isPresent());
        }

        BigDecimal credit;
        switch (behavior) {
            case NONE -> {
                notes.add("Reciprocity: no credit for tax paid elsewhere");
                return ReciprocityOutcome.denied(notes, override.isPresent());
            }
            case HOME_STATE_ONLY -> {
                if (!Boolean.TRUE.equals(input.getOriginIsHomeState())) {
                    notes.add("Reciprocity: credit limited to tax paid to the buyer's home state; origin not confirmed"
                            + " as home state");
                    return ReciprocityOutcome.denied(notes, override.isPresent());
                }
                credit = cappedCredit(collected, taxDue, capAtThisStatesTax);
            }
            case CREDIT_UP_TO_STATE_RATE, CREDIT_FULL -> credit = cappedCredit(collected, taxDue, capAtThisStatesTax);
            default -> throw new IllegalStateException("Unhandled reciprocity behavior: " + behavior);
        }

        notes.add("Reciprocity credit (" + behavior + "): " + display(credit) + " of " + display(collected)
                + " paid elsewhere" + (capAtThisStatesTax ? ", capped at this jurisdiction's tax" : ""));
        return new ReciprocityOutcome(credit, true, override.isPresent(), notes);
    }

    /**
     * Exact origin match first (case-insensitive), then the {@code ALL} wildcard. Reverse
     * rules and overrides restricted to another vehicle class or weight range never match.
     */
    static Optional<ReciprocityOverride> findOverride(TaxCalculationInput input, List<ReciprocityOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return Optional.empty();
        }
        List<ReciprocityOverride> applicable = new ArrayList<>();
        for (ReciprocityOverride candidate : overrides) {
            if (candidate != null && !candidate.isReverseRule() && appliesToVehicle(candidate, input)) {
                applicable.add(candidate);
            }
        }
        String originState = input.getOriginState();
        if (originState != null && !originState.isBlank()) {
            String origin = originState.trim();
            Optional<ReciprocityOverride> exact = applicable.stream()
                    .filter(o -> !ReciprocityOverride.ANY_ORIGIN.equalsIgnoreCase(o.getOriginState()))
                    .filter(o -> origin.equalsIgnoreCase(o.getOriginState()))
                    .findFirst();
            if (exact.isPresent()) {
                return exact;
            }
        }
        return applicable.stream()
                .filter(o -> ReciprocityOverride.ANY_ORIGIN.equalsIgnoreCase(o.getOriginState()))
                .findFirst();
    }

    private static boolean appliesToVehicle(ReciprocityOverride override, TaxCalculationInput input) {
        List<VehicleClass> classes = override.getAppliesToVehicleClasses();
        if (classes != null && !classes.isEmpty()
                && !classes.contains(VehicleClass.resolve(input.getVehicleClass(), input.getGvwLbs()))) {
            return false;
        }
        return override.getAppliesToGvwRange() == null
                || input.getGvwLbs() == null
                || override.getAppliesToGvwRange().contains(input.getGvwLbs());
    }

    /** The origin state must itself credit tax paid here: a reverse rule naming it that neither denies nor is NONE. */
    private static boolean hasMutualCredit(
            String originState, List<ReciprocityOverride> overrides, List<String> notes) {
        if (originState == null || originState.isBlank()) {
            notes.add("Reciprocity: mutual credit required but the origin state is unknown; no credit applied");
            return false;
        }
        String origin = originState.trim();
        Optional<ReciprocityOverride> reverse = overrides.stream()
                .filter(o -> o != null && o.isReverseRule())
                .filter(o -> origin.equalsIgnoreCase(o.getDestinationState()))
                .findFirst();
        if (reverse.isEmpty()) {
            notes.add("Reciprocity: mutual credit required but " + origin
                    + " has no reciprocity rule for vehicles taxed here; no credit applied");
            return false;
        }
        if (reverse.get().isDisallowCredit() || reverse.get().getBehavior() == ReciprocityBehavior.NONE) {
            notes.add("Reciprocity: mutual credit required but " + origin
                    + " gives no credit for tax paid here; no credit applied");
            return false;
        }
        notes.add("Reciprocity: mutual credit confirmed with " + origin);
        return true;
    }

    /**
     * Consistency problems in a jurisdiction's overrides: missing origins, negative time
     * windows, duplicates for the same origin, direction and vehicle restriction, and
     * mutual-credit requirements that point at each other.
     *
     * @return one message per problem; empty when the rules are consistent
     */
    public static List<String> validate(String stateCode, ReciprocityRules rules) {
        List<String> errors = new ArrayList<>();
        if (rules == null || rules.getOverrides() == null) {
            return errors;
        }
        List<ReciprocityOverride> overrides = rules.getOverrides();
        Set<String> seen = new HashSet<>();
        for (ReciprocityOverride override : overrides) {
            if (override == null || (!override.isReverseRule() && isBlank(override.getOriginState()))) {
                errors.add("Reciprocity override without originState");
                continue;
            }
            String direction = direction(stateCode, override);
            if (override.getMaxAgeDaysSinceTaxPaid() != null && override.getMaxAgeDaysSinceTaxPaid() < 0) {
                errors.add("Invalid time window for " + direction + ": "
                        + override.getMaxAgeDaysSinceTaxPaid() + " days");
            }
            String weight = override.getAppliesToGvwRange() != null
                    ? override.getAppliesToGvwRange().describe()
                    : "any weight";
            String key = direction + " " + override.getAppliesToVehicleClasses() + " " + weight;
            if (!seen.add(key)) {
                errors.add("Duplicate reciprocity override: " + key);
            }
            if (override.isRequiresMutualCredit() && !override.isReverseRule()) {
                String origin = override.getOriginState().trim();
                boolean circular = overrides.stream()
                        .filter(o -> o != null && o.isReverseRule() && o.isRequiresMutualCredit())
                        .anyMatch(o -> origin.equalsIgnoreCase(o.getDestinationState().trim()));
                if (circular) {
                    errors.add("Circular mutual credit requirement: " + direction);
                }
            }
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String direction(String stateCode, ReciprocityOverride override) {
        String here = stateCode != null ? stateCode : "this state";
        if (override.isReverseRule()) {
            return here + "->" + override.getDestinationState().trim().toUpperCase(Locale.ROOT);
        }
        return override.getOriginState().trim().toUpperCase(Locale.ROOT) + "->" + here;
    }

    static boolean withinWindow(TaxCalculationInput input, int maxAgeDays, List<String> notes) {
        LocalDate paidDate = input.getOriginTaxPaidDate();
        LocalDate asOfDate = input.getAsOfDate();
        if (paidDate == null || asOfDate == null) {
            notes.add("Reciprocity: credit requires tax paid within " + maxAgeDays
                    + " days but the payment or transaction date is missing; no credit applied");
            return false;
        }
        long age = ChronoUnit.DAYS.between(paidDate, asOfDate);
        if (age > maxAgeDays) {
            notes.add("Reciprocity: tax was paid " + age + " days ago, outside the " + maxAgeDays
                    + "-day window; no credit applied");
            return false;
        }
        return true;
    }

    private static BigDecimal cappedCredit(BigDecimal collected, BigDecimal taxDue, boolean capAtThisStatesTax) {
        if (!capAtThisStatesTax) {
            return collected;
        }
        return Amounts.min(collected, Amounts.nonNegative(taxDue));
    }

    /** Result of a reciprocity evaluation. {@code credit} is zero whenever {@code creditAllowed} is false. */
    @Value
    public static class ReciprocityOutcome {
        BigDecimal credit;
        boolean creditAllowed;
        boolean overrideApplied;
        List<String> notes;

        static ReciprocityOutcome denied(List<String> notes, boolean overrideApplied) {
            return new ReciprocityOutcome(BigDecimal.ZERO, false, overrideApplied, notes);
        }
    }
}
