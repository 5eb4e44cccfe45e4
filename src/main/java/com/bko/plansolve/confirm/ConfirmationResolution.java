package com.bko.plansolve.confirm;

public enum ConfirmationResolution {
    NONE,
    CONFIRMED,
    DECLINED,
    TIMED_OUT;

    /**
     * A timed-out confirmation counts as declined.
     */
    public boolean isAccepted() {
        return this == CONFIRMED;
    }
}
