package com.bko.plansolve.api;

public record ApiError(
        String errorCode,
        String message
) {
}
