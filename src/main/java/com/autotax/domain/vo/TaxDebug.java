package com.autotax.domain.vo;

import com.autotax.domain.model.FeeLine;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Audit trail of a calculation: the amounts each policy decision produced, plus an
 * ordered list of human-readable notes explaining every non-default decision.
 */
@Value
@Builder
public class TaxDebug {

    /** Prefix of notes recording a fallback taken for a configuration gap. */
    public static final String WARNING_PREFIX = "WARNING:";

    BigDecimal appliedTradeIn;
    BigDecimal appliedRebatesTaxable;
    BigDecimal appliedRebatesNonTaxable;
    BigDecimal taxableDocFee;
    List<FeeLine> taxableFees;
    BigDecimal taxableServiceContracts;
    BigDecimal taxableGap;
    BigDecimal reciprocityCredit;
    boolean taxCapApplied;
    List<String> notes;

    /** True when any fallback was taken for missing or unrecognized configuration. */
    public boolean isDegraded() {
        return notes != null && notes.stream().anyMatch(note -> note.startsWith(WARNING_PREFIX));
    }
}
