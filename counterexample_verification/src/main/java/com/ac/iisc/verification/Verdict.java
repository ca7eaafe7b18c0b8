package com.ac.iisc.verification;

/**
 * Outcome of executing both queries of a case.
 * {@link #EQUAL} and {@link #NOT_EQUAL} are only produced when both queries ran.
 */
public enum Verdict
{
    EQUAL("True"),
    NOT_EQUAL("False"),
    ERROR("Error");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    /** Value written to the {@code equal} column of the results CSV. */
    public String getLabel() {
        return label;
    }
}
