package com.example.governance.coordination;

/**
 * Contract violation on the coordinator API: unknown session, join outside planning,
 * unauthorized agent, or no healthy participants.
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }
}
