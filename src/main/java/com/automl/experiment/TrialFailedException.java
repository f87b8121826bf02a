package com.automl.experiment;

/**
 * A trial runner failed with a checked exception unrelated to cancellation.
 */
public class TrialFailedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int trialId;

    public TrialFailedException(int trialId, Throwable cause) {
        super("trial " + trialId + " failed: " + cause.getMessage(), cause);
        this.trialId = trialId;
    }

    public int getTrialId() {
        return trialId;
    }
}
