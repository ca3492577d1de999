package com.autotax.engine.interpreter;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.model.FeeTaxRule;
import com.autotax.domain.model.LeaseRules;
import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.domain.model.TitleFeeRule;
import java.util.List;
import java.util.Optional;

/**
 * Fee-code taxability. Retail deals use {@code feeTaxRules}; lease deals use the lease fee
 * rules plus the lease title-fee rules. Codes match case-insensitively and an unknown
 * code is never taxable.
 */
public final class FeeTaxabilityInterpreter {

    /** Lease fee rule codes that carry product taxability on leases. */
    public static final String SERVICE_CONTRACT = "SERVICE_CONTRACT";

    public static final String GAP = "GAP";

    private FeeTaxabilityInterpreter() {}

    public static boolean isFeeTaxable(String code, DealType dealType, TaxRulesConfig rules) {
        if (dealType == DealType.LEASE) {
            return isLeaseFeeTaxable(code, rules.getLeaseRules());
        }
        return findRule(code, rules.getFeeTaxRules()).map(FeeTaxRule::isTaxable).orElse(false);
    }

    /** True when a fee code has any rule for the deal type; unknown codes are reported in notes. */
    public static boolean isKnownFee(String code, DealType dealType, TaxRulesConfig rules) {
        if (dealType == DealType.LEASE) {
            LeaseRules leaseRules = rules.getLeaseRules();
            return leaseRules != null
                    && (findRule(code, leaseRules.getFeeTaxRules()).isPresent()
                            || findTitleRule(code, leaseRules.getTitleFeeRules()).isPresent());
        }
        return findRule(code, rules.getFeeTaxRules()).isPresent();
    }

    public static boolean isLeaseFeeTaxable(String code, LeaseRules leaseRules) {
        if (leaseRules == null) {
            return false;
        }
        boolean feeRuleTaxable =
                findRule(code, leaseRules.getFeeTaxRules()).map(FeeTaxRule::isTaxable).orElse(false);
        boolean titleRuleTaxable = findTitleRule(code, leaseRules.getTitleFeeRules())
                .map(TitleFeeRule::isTaxable)
                .orElse(false);
        return feeRuleTaxable || titleRuleTaxable;
    }

    /** A taxable lease fee is taxed at signing unless its title-fee rule excludes it from upfront. */
    public static boolean isLeaseFeeTaxedUpfront(String code, LeaseRules leaseRules) {
        if (leaseRules == null) {
            return true;
        }
        return findTitleRule(code, leaseRules.getTitleFeeRules())
                .map(TitleFeeRule::isIncludedInUpfront)
                .orElse(true);
    }

    public static Optional<FeeTaxRule> findRule(String code, List<FeeTaxRule> rules) {
        if (code == null || rules == null) {
            return Optional.empty();
        }
        return rules.stream().filter(rule -> rule != null && code.equalsIgnoreCase(rule.getCode())).findFirst();
    }

    private static Optional<TitleFeeRule> findTitleRule(String code, List<TitleFeeRule> rules) {
        if (code == null || rules == null) {
            return Optional.empty();
        }
        return rules.stream().filter(rule -> rule != null && code.equalsIgnoreCase(rule.getCode())).findFirst();
    }
}
