package com.automl.cancellation;

import java.util.concurrent.CancellationException;

public class TrialCancelledException extends CancellationException {
    private static final long serialVersionUID = 1L;

    public TrialCancelledException(String message) {
        super(message);
    }
}
