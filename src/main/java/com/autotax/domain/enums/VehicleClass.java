package com.autotax.domain.enums;

/**
 * Registration class of the vehicle. Selects class-specific privilege tax rates and
 * class-restricted reciprocity overrides.
 */
public enum VehicleClass {
    PASSENGER,
    LIGHT_TRUCK,
    HEAVY_TRUCK,
    MOTORCYCLE,
    RV,
    TRAILER,
    COMMERCIAL,
    BUS;

    private static final int PASSENGER_MAX_GVW_LBS = 10_000;
    private static final int LIGHT_TRUCK_MAX_GVW_LBS = 26_000;

    /**
     * The explicit class when given, otherwise inferred from gross vehicle weight,
     * otherwise PASSENGER.
     */
    public static VehicleClass resolve(VehicleClass explicit, Integer gvwLbs) {
        if (explicit != null) {
            return explicit;
        }
        if (gvwLbs == null) {
            return PASSENGER;
        }
        if (gvwLbs <= PASSENGER_MAX_GVW_LBS) {
            return PASSENGER;
        }
        return gvwLbs <= LIGHT_TRUCK_MAX_GVW_LBS ? LIGHT_TRUCK : HEAVY_TRUCK;
    }
}
