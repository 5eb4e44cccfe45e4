package com.bko.plansolve.error;

import java.time.Duration;

public class ConfirmationTimeoutException extends PlanSolveException {

    public ConfirmationTimeoutException(String stepId, Duration timeout) {
        super(ErrorCode.CONFIRMATION_TIMEOUT,
                "No confirmation received for step " + stepId + " within " + timeout.toSeconds() + "s");
    }
}
