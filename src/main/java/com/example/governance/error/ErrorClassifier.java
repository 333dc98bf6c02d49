package com.example.governance.error;

/**
 * Maps a raw failure to an {@link ErrorClassification}. Implementations live outside this module.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClassification classify(Throwable error, ErrorContext context);
}
