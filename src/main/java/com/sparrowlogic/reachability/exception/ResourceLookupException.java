package com.sparrowlogic.reachability.exception;

public class ResourceLookupException extends RuntimeException {

    public ResourceLookupException(String message) {
        super(message);
    }

    public ResourceLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
