package com.autotax.domain.model;

import com.autotax.domain.enums.ReciprocityBehavior;
import com.autotax.domain.enums.VehicleClass;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Origin-specific replacement for the generic reciprocity computation. {@code originState}
 * is a state code or a marker such as {@code TRIBAL}; {@code ALL} matches any origin.
 * Null fields fall back to the jurisdiction-wide {@link ReciprocityRules} values.
 *
 * <p>An override with a {@code destinationState} describes the reverse direction: how
 * that other state treats vehicles taxed here. It is never applied to a deal; it answers
 * {@code requiresMutualCredit} checks for that state.
 */
@Value
@Builder
@Jacksonized
public class ReciprocityOverride {

    public static final String ANY_ORIGIN = "ALL";

    String originState;

    /** Null for overrides applied by this jurisdiction. */
    String destinationState;

    boolean disallowCredit;
    ReciprocityBehavior behavior;
    Boolean capAtThisStatesTax;
    Integer maxAgeDaysSinceTaxPaid;

    /** Credit only when the origin state also credits tax paid here. */
    boolean requiresMutualCredit;

    /** Credit only when the owner is unchanged since the earlier tax was paid. */
    boolean requiresSameOwner;

    /** Empty means every vehicle class. */
    @Builder.Default
    List<VehicleClass> appliesToVehicleClasses = List.of();

    /** Null means any weight; ignored when the deal carries no weight. */
    GvwRange appliesToGvwRange;

    String notes;

    @JsonIgnore
    public boolean isReverseRule() {
        return destinationState != null && !destinationState.isBlank();
    }
}
