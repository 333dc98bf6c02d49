package com.example.governance.error;

/** Exceptions that already know which {@link ErrorType} they represent. */
public interface ClassifiedFailure {

    ErrorType errorType();
}
