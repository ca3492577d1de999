package com.autotax.domain.enums;

/** When lease tax is collected. */
public enum LeaseMethod {

    /** Tax on each periodic payment, plus configured upfront items. */
    MONTHLY,

    /** Tax on the whole adjusted cap cost once at signing. */
    FULL_UPFRONT,

    /** Cap cost reduction, fees and products upfront, payments taxed monthly. */
    HYBRID
}
