package com.activelearn.pipeline;

public class InsufficientDataException extends Exception {
    private final String agent;
    private final int available;
    private final int required;

    public InsufficientDataException(String agent, int available, int required) {
        this(agent, available, required, "Insufficient examples for " + agent + ": " + available + " < " + required);
    }

    public InsufficientDataException(String agent, int available, int required, String message) {
        super(message);
        this.agent = agent;
        this.available = available;
        this.required = required;
    }

    public String agent() {
        return agent;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
