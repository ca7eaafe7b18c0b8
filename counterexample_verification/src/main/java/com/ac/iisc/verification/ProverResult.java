package com.ac.iisc.verification;

/**
 * What the external equivalence prover reported for one query pair at one
 * bound size, or the canonical outcome when the call failed or ran too long.
 */
public final class ProverResult
{
    /** Value written to the {@code equivalent} column. */
    public enum Status
    {
        EQUIVALENT("True"),
        NOT_EQUIVALENT("False"),
        ERROR("ERROR"),
        TIMEOUT("TIMEOUT");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Status status;
    private final String counterexample;
    private final Double timeCost;

    public ProverResult(Status status, String counterexample, Double timeCost)
    {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        this.status = status;
        this.counterexample = counterexample == null ? "" : counterexample;
        this.timeCost = timeCost;
    }

    public static ProverResult equivalent(Double timeCost) {
        return new ProverResult(Status.EQUIVALENT, "", timeCost);
    }

    public static ProverResult notEquivalent(String counterexample, Double timeCost) {
        return new ProverResult(Status.NOT_EQUIVALENT, counterexample, timeCost);
    }

    /** A prover call that threw; the counterexample column carries "Type: message". */
    public static ProverResult error(Throwable cause) {
        return new ProverResult(Status.ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage(), null);
    }

    public static ProverResult timeout() {
        return new ProverResult(Status.TIMEOUT, "", null);
    }

    public Status getStatus() { return status; }

    /** Counterexample block text; "" when there is none. */
    public String getCounterexample() { return counterexample; }

    /** Seconds the prover reported spending, or null when unknown. */
    public Double getTimeCost() { return timeCost; }

    @Override
    public String toString() {
        return "ProverResult{" + status + (timeCost == null ? "" : ", " + timeCost + "s") + "}";
    }
}
