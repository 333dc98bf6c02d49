package com.example.governance.degradation;

/**
 * Carries out a fallback strategy's action. Throwing marks the activation as failed; the
 * degradation manager logs it and keeps going.
 */
@FunctionalInterface
public interface FallbackActivator {

    void activate(FallbackStrategy strategy);
}
