package com.example.governance.recovery.action;

/**
 * A recovery action failed or did not finish within its timeout.
 */
public class ActionExecutionException extends RuntimeException {

    private final String actionId;
    private final boolean timedOut;

    public ActionExecutionException(String actionId, String message, Throwable cause) {
        this(actionId, message, cause, false);
    }

    public ActionExecutionException(String actionId, String message, Throwable cause, boolean timedOut) {
        super("Action " + actionId + " failed: " + message, cause);
        this.actionId = actionId;
        this.timedOut = timedOut;
    }

    public String actionId() {
        return actionId;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
