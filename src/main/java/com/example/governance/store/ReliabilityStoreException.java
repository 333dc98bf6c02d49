package com.example.governance.store;

public class ReliabilityStoreException extends RuntimeException {

    public ReliabilityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
