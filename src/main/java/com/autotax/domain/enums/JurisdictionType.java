package com.autotax.domain.enums;

/** Level of government levying one slice of a combined rate. */
public enum JurisdictionType {
    STATE,
    COUNTY,
    CITY,
    SPECIAL_DISTRICT
}
