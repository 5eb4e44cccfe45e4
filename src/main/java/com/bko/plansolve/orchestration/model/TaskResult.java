package com.bko.plansolve.orchestration.model;

public record TaskResult(String output) {
}
