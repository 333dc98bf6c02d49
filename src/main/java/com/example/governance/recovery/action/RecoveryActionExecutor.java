package com.example.governance.recovery.action;

import com.example.governance.recovery.RecoveryAction;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Carries out a single {@link RecoveryAction}.
 */
public interface RecoveryActionExecutor {

    /**
     * @param targetAgentId agent the action is addressed to, or null for an action applied
     *                      to this process
     */
    CompletableFuture<Void> execute(RecoveryAction action, String targetAgentId);

    /**
     * Runs the action and waits at most {@code action.timeoutMs()}.
     *
     * @throws ActionExecutionException on failure or timeout
     */
    default void executeAndWait(RecoveryAction action, String targetAgentId) {
        CompletableFuture<Void> future;
        try {
            future = execute(action, targetAgentId);
        } catch (RuntimeException e) {
            throw new ActionExecutionException(action.actionId(), String.valueOf(e.getMessage()), e);
        }
        try {
            future.orTimeout(action.timeoutMs(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ActionExecutionException ae) {
                throw ae;
            }
            if (cause instanceof TimeoutException) {
                throw new ActionExecutionException(action.actionId(),
                        "timed out after " + action.timeoutMs() + "ms", cause, true);
            }
            throw new ActionExecutionException(action.actionId(), String.valueOf(cause.getMessage()), cause);
        }
    }
}
