package com.autotax.engine.interpreter;

import com.autotax.domain.enums.RebateAppliesTo;
import com.autotax.domain.enums.RebateParty;
import com.autotax.domain.model.RebateRule;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a rebate stays in the taxable base.
 *
 * <p>Lookup order: a rule naming the party exactly, then an {@code ANY} rule. With no
 * matching rule the rebate is non-taxable (it reduces the base).
 */
public final class RebateTaxabilityInterpreter {

    private RebateTaxabilityInterpreter() {}

    public static boolean isRebateTaxable(RebateParty party, List<RebateRule> rules) {
        return findRule(party, rules).map(RebateRule::isTaxable).orElse(false);
    }

    public static Optional<RebateRule> findRule(RebateParty party, List<RebateRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return Optional.empty();
        }
        Optional<RebateRule> exact = rules.stream()
                .filter(rule -> rule != null && rule.getAppliesTo() != null)
                .filter(rule -> rule.getAppliesTo() != RebateAppliesTo.ANY)
                .filter(rule -> rule.getAppliesTo().matches(party))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return rules.stream()
                .filter(rule -> rule != null && rule.getAppliesTo() == RebateAppliesTo.ANY)
                .findFirst();
    }
}
