package com.autotax.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Inclusive gross-vehicle-weight range in pounds; a null bound is open. */
@Value
@Builder
@Jacksonized
public class GvwRange {

    Integer minLbs;
    Integer maxLbs;

    public boolean contains(int gvwLbs) {
        return (minLbs == null || gvwLbs >= minLbs) && (maxLbs == null || gvwLbs <= maxLbs);
    }

    public String describe() {
        if (minLbs == null && maxLbs == null) {
            return "any weight";
        }
        if (minLbs == null) {
            return "up to " + maxLbs + " lbs";
        }
        if (maxLbs == null) {
            return minLbs + " lbs and over";
        }
        return minLbs + "-" + maxLbs + " lbs";
    }
}
