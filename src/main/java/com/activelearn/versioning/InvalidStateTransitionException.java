package com.activelearn.versioning;

public class InvalidStateTransitionException extends IllegalStateException {
    private final String action;
    private final String actualState;

    public InvalidStateTransitionException(String action, String actualState, String requiredState) {
        super("Cannot " + action + ": current state is " + actualState + ", requires " + requiredState);
        this.action = action;
        this.actualState = actualState;
    }

    public String action() {
        return action;
    }

    public String actualState() {
        return actualState;
    }
}
