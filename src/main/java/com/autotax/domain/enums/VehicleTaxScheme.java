package com.autotax.domain.enums;

/**
 * Overall structure of a jurisdiction's vehicle tax.
 *
 * <p>The special schemes (HUT, TAVT, privilege tax) are titling taxes. With their parameter
 * block in {@link com.autotax.domain.model.TaxRulesExtras} they get a dedicated base and
 * rate; without it they pass the rate list through unchanged.
 */
public enum VehicleTaxScheme {

    /** Only the component labeled STATE applies. */
    STATE_ONLY,

    /** State plus every local component (county, city, districts). */
    STATE_PLUS_LOCAL,

    /** No state-level tax; only local components apply. */
    LOCAL_ONLY,

    /** North Carolina style Highway Use Tax. */
    SPECIAL_HUT,

    /** Georgia style Title Ad Valorem Tax. */
    SPECIAL_TAVT,

    /** West Virginia style DMV privilege tax. */
    DMV_PRIVILEGE_TAX
}
