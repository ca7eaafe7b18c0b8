package com.ac.iisc.verification;

/** How two result sets are compared. Chosen once per run. */
public enum ComparisonMode
{
    /** Rows must appear in the same sequence. */
    ORDER_SENSITIVE,
    /** Rows are compared as a multiset. */
    ORDER_INSENSITIVE;

    public static ComparisonMode of(boolean orderSensitive) {
        return orderSensitive ? ORDER_SENSITIVE : ORDER_INSENSITIVE;
    }
}
