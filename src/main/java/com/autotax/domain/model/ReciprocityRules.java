package com.autotax.domain.model;

import com.autotax.domain.enums.ReciprocityBasis;
import com.autotax.domain.enums.ReciprocityBehavior;
import com.autotax.domain.enums.ReciprocityScope;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Credit a jurisdiction gives for sales/use tax already paid elsewhere on the vehicle. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReciprocityRules {

    boolean enabled;

    @Builder.Default
    ReciprocityScope scope = ReciprocityScope.BOTH;

    @Builder.Default
    ReciprocityBehavior homeStateBehavior = ReciprocityBehavior.NONE;

    boolean requireProofOfTaxPaid;

    @Builder.Default
    ReciprocityBasis basis = ReciprocityBasis.TAX_PAID;

    @Builder.Default
    boolean capAtThisStatesTax = true;

    /** Lease deals get no credit (lease tax is the lessor's liability). */
    boolean hasLeaseException;

    @Builder.Default
    List<ReciprocityOverride> overrides = List.of();

    String notes;

    public static ReciprocityRules disabled() {
        return ReciprocityRules.builder().enabled(false).build();
    }
}
