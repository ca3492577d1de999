package com.autotax.engine.interpreter;

import static com.autotax.engine.Amounts.display;

import com.autotax.domain.enums.TradeInPolicyType;
import com.autotax.domain.model.TradeInPolicy;
import com.autotax.engine.Amounts;
import java.math.BigDecimal;
import java.util.List;

/**
 * Converts a raw trade-in value into the credit a jurisdiction allows.
 *
 * <p>The credit is not clamped against the vehicle price here; the orchestrator clamps
 * the resulting base at zero. A missing policy, or a CAPPED/PERCENT policy without its
 * parameter, is a configuration gap and yields no credit with a warning note.
 */
public final class TradeInPolicyInterpreter {

    private TradeInPolicyInterpreter() {}

    /**
     * @param policy       the jurisdiction's trade-in policy (may be null)
     * @param tradeInValue raw trade-in value; negative values are treated as zero
     * @param vehiclePrice vehicle price, used only to annotate credits that exceed it
     * @param notes        debug trace, appended to
     * @return the applied credit, never negative
     */
    public static BigDecimal interpret(
            TradeInPolicy policy, BigDecimal tradeInValue, BigDecimal vehiclePrice, List<String> notes) {
        BigDecimal value = Amounts.nonNegative(tradeInValue);
        TradeInPolicyType type = policy != null ? policy.getType() : null;

        if (type == null) {
            notes.add("WARNING: Trade-in policy missing or unrecognized; no trade-in credit applied");
            return BigDecimal.ZERO;
        }

        BigDecimal credit;
        switch (type) {
            case NONE -> {
                notes.add("Trade-in policy: NONE (no credit allowed)");
                credit = BigDecimal.ZERO;
            }
            case FULL -> {
                notes.add("Trade-in policy: FULL credit of " + display(value));
                credit = value;
            }
            case CAPPED -> {
                if (policy.getCapAmount() == null) {
                    notes.add("WARNING: CAPPED trade-in policy has no cap amount; no trade-in credit applied");
                    return BigDecimal.ZERO;
                }
                BigDecimal cap = Amounts.nonNegative(policy.getCapAmount());
                credit = Amounts.min(value, cap);
                notes.add("Trade-in policy: CAPPED at " + display(cap) + " (applied " + display(credit) + ")");
            }
            case PERCENT -> {
                if (policy.getPercent() == null) {
                    notes.add("WARNING: PERCENT trade-in policy has no percent; no trade-in credit applied");
                    return BigDecimal.ZERO;
                }
                BigDecimal percent = clampFraction(policy.getPercent());
                credit = value.multiply(percent);
                notes.add("Trade-in policy: " + Amounts.displayRate(percent) + " credit (applied " + display(credit)
                        + ")");
            }
            default -> throw new IllegalStateException("Unhandled trade-in policy: " + type);
        }

        if (vehiclePrice != null && credit.compareTo(vehiclePrice) > 0) {
            notes.add("Trade-in credit " + display(credit) + " exceeds vehicle price " + display(vehiclePrice));
        }
        return credit;
    }

    private static BigDecimal clampFraction(BigDecimal percent) {
        if (percent.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return percent.compareTo(BigDecimal.ONE) > 0 ? BigDecimal.ONE : percent;
    }
}
