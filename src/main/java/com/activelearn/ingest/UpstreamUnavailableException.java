package com.activelearn.ingest;

import java.io.IOException;

public class UpstreamUnavailableException extends IOException {
    private final String source;

    public UpstreamUnavailableException(String source, String message) {
        super(message);
        this.source = source;
    }

    public UpstreamUnavailableException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
