package com.example.governance.recovery;

/**
 * Carries an unsuccessful {@link RecoveryResult} through a circuit breaker so the attempt
 * counts as a failure. Callers unwrap it with {@link #result()}.
 */
public class UnresolvedRecoveryException extends RuntimeException {

    private final transient RecoveryResult result;

    public UnresolvedRecoveryException(RecoveryResult result) {
        super(result.error() == null ? "recovery did not resolve the error" : result.error());
        this.result = result;
    }

    public RecoveryResult result() {
        return result;
    }
}
