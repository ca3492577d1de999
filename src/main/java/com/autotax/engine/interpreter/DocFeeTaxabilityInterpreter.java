package com.autotax.engine.interpreter;

import com.autotax.domain.enums.DealType;
import com.autotax.domain.enums.LeaseDocFeeTaxability;
import com.autotax.domain.model.TaxRulesConfig;

/** Doc fee taxability per deal type. */
public final class DocFeeTaxabilityInterpreter {

    private DocFeeTaxabilityInterpreter() {}

    public static boolean isDocFeeTaxable(DealType dealType, TaxRulesConfig rules) {
        if (dealType != DealType.LEASE) {
            return rules.isDocFeeTaxable();
        }
        LeaseDocFeeTaxability taxability =
                rules.getLeaseRules() != null ? rules.getLeaseRules().getDocFeeTaxability() : null;
        if (taxability == null) {
            return rules.isDocFeeTaxable();
        }
        return switch (taxability) {
            case ALWAYS, ONLY_UPFRONT -> true;
            case NEVER -> false;
            case FOLLOW_RETAIL_RULE -> rules.isDocFeeTaxable();
        };
    }

    /** ONLY_UPFRONT doc fees are taxed at signing even when other fees ride in the payment. */
    public static boolean isDocFeeUpfrontOnly(TaxRulesConfig rules) {
        return rules.getLeaseRules() != null
                && rules.getLeaseRules().getDocFeeTaxability() == LeaseDocFeeTaxability.ONLY_UPFRONT;
    }
}
