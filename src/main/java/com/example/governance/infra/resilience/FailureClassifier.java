package com.example.governance.infra.resilience;

import com.example.governance.error.ClassifiedFailure;
import com.example.governance.error.ErrorType;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Central exception → {@link ErrorType} mapping used for rolling-window samples.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static ErrorType classify(Throwable t) {
        Throwable e = unwrap(t);
        if (e == null) {
            return ErrorType.SYSTEM_ERROR;
        }
        if (e instanceof ClassifiedFailure cf && cf.errorType() != null) {
            return cf.errorType();
        }
        if (e instanceof ConnectException) {
            return ErrorType.NETWORK_ERROR;
        }
        if (e instanceof TimeoutException
                || e instanceof SocketTimeoutException
                || e instanceof HttpTimeoutException) {
            return ErrorType.TIMEOUT_ERROR;
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("econnrefused") || msg.contains("connection refused")) {
            return ErrorType.NETWORK_ERROR;
        }
        if (msg.contains("etimedout") || msg.contains("timed out")) {
            return ErrorType.TIMEOUT_ERROR;
        }
        if (msg.contains("database") || msg.contains("sql")) {
            return ErrorType.DATABASE_ERROR;
        }
        if (msg.contains("unauthorized")) {
            return ErrorType.AUTHENTICATION_ERROR;
        }
        if (msg.contains("forbidden")) {
            return ErrorType.AUTHORIZATION_ERROR;
        }
        if (msg.contains("429") || msg.contains("too many requests") || msg.contains("rate limit")) {
            return ErrorType.RATE_LIMIT_ERROR;
        }
        return ErrorType.SYSTEM_ERROR;
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
