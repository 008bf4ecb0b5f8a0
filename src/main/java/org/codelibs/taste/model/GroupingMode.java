package org.codelibs.taste.model;

import java.util.Locale;

import org.codelibs.taste.exception.InvalidParameterException;

/**
 * How {@link UserGrouper} collects the ratings of a user.
 */
public enum GroupingMode {
    /** Every user's ratings are collected before the first profile is emitted. Input order is free. */
    FULL,
    /** Ratings of a user must be adjacent in the input. Only one profile is held at a time. */
    CONTIGUOUS;

    public static GroupingMode of(final String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new InvalidParameterException("Unknown grouping mode: "
                    + value, e);
        }
    }
}
