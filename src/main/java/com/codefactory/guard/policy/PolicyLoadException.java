package com.codefactory.guard.policy;

public class PolicyLoadException extends RuntimeException {

    public PolicyLoadException(String message) {
        super(message);
    }

    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
