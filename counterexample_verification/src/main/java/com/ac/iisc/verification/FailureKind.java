package com.ac.iisc.verification;

/**
 * Why a case ended with {@link Verdict#ERROR}. Malformed blocks never become
 * cases, so there is no parse kind here.
 */
public enum FailureKind
{
    NONE,
    /** The setup script failed; neither query was attempted. */
    SETUP,
    /** At least one query failed. */
    QUERY,
    /** The case exceeded its wall-clock budget. */
    TIMEOUT,
    /** Anything else thrown while running the case (driver missing, etc.). */
    INTERNAL
}
