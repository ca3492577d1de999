package com.autotax.domain.enums;

/** Where a local rate lookup got its numbers from. */
public enum LocalRateSource {
    ZIP_EXACT,
    STATE_AVERAGE,
    STATE_ONLY
}
