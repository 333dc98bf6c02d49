package com.example.governance.observability;

@FunctionalInterface
public interface ReliabilityEventListener {

    void onEvent(ReliabilityEvent event);
}
