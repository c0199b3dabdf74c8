package com.tallybook.ledger.model;

import java.util.Locale;

/**
 * What to do when an imported price collides with an existing record
 * for the same product, company and period.
 */
public enum ConflictMode {
    SKIP,
    OVERWRITE;

    /** Unknown or missing values fall back to {@link #SKIP}. */
    public static ConflictMode from(String value) {
        if (value == null) return SKIP;
        return "overwrite".equals(value.trim().toLowerCase(Locale.ROOT)) ? OVERWRITE : SKIP;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
