package com.bko.plansolve.error;

/**
 * Well-formed envelope whose content is missing required business fields, or a command
 * that the session cannot accept in its current stage.
 */
public class ValidationException extends PlanSolveException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
