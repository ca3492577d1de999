package com.autotax.domain.enums;

/** How much credit a jurisdiction gives for tax already paid elsewhere. */
public enum ReciprocityBehavior {

    /** No credit for tax paid elsewhere. */
    NONE,

    /** Credit for tax paid, limited to this jurisdiction's tax when capping is on. */
    CREDIT_UP_TO_STATE_RATE,

    /** Dollar-for-dollar credit for tax paid. */
    CREDIT_FULL,

    /** Credit only when the origin is the owner's home state. */
    HOME_STATE_ONLY
}
