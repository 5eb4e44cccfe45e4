package com.bko.plansolve.session;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStage {
    CREATED,
    PLANNING,
    AWAITING_CONFIRM,
    SOLVING,
    AGGREGATING,
    COMPLETED,
    CANCELLED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }

    public boolean canTransitionTo(SessionStage target) {
        return allowedTargets().contains(target);
    }

    public Set<SessionStage> allowedTargets() {
        return switch (this) {
            case CREATED -> EnumSet.of(PLANNING, SOLVING, CANCELLED, ERROR);
            case PLANNING -> EnumSet.of(PLANNING, AWAITING_CONFIRM, SOLVING, CANCELLED, ERROR);
            case AWAITING_CONFIRM -> EnumSet.of(SOLVING, PLANNING, CANCELLED, ERROR);
            // COMPLETED directly from SOLVING only for task lists submitted without aggregation
            case SOLVING -> EnumSet.of(AGGREGATING, PLANNING, COMPLETED, CANCELLED, ERROR);
            case AGGREGATING -> EnumSet.of(COMPLETED, PLANNING, CANCELLED, ERROR);
            case COMPLETED, CANCELLED, ERROR -> EnumSet.noneOf(SessionStage.class);
        };
    }
}
