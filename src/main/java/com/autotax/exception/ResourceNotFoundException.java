package com.autotax.exception;

import java.util.Map;

/** A jurisdiction or rate lookup with no data behind it. */
public class ResourceNotFoundException extends BaseException {

    private ResourceNotFoundException(String message, Map<String, Object> details) {
        super(ErrorCode.NOT_FOUND, message, details);
    }

    public static ResourceNotFoundException taxRules(String stateCode) {
        return new ResourceNotFoundException(
                "No tax rules for state " + stateCode, Map.of("stateCode", String.valueOf(stateCode)));
    }

    public static ResourceNotFoundException stateRates(String stateCode) {
        return new ResourceNotFoundException(
                "No state tax rates for " + stateCode, Map.of("stateCode", String.valueOf(stateCode)));
    }

    /** The ZIP code is not in the local rate table and no state was given to fall back on. */
    public static ResourceNotFoundException zipWithoutState(String zipCode) {
        return new ResourceNotFoundException(
                "ZIP code " + zipCode + " has no local rates and no state code was given",
                Map.of("zipCode", String.valueOf(zipCode)));
    }
}
