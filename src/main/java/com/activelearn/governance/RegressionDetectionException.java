package com.activelearn.governance;

public class RegressionDetectionException extends Exception {

    public RegressionDetectionException(String message) {
        super(message);
    }

    public RegressionDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
