package com.activelearn.versioning;

public class MissingBackupException extends IllegalStateException {
    private final String agent;

    public MissingBackupException(String agent) {
        super("No backup bundle available for " + agent);
        this.agent = agent;
    }

    public String agent() {
        return agent;
    }
}
