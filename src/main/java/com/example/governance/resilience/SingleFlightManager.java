package com.example.governance.resilience;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Request coalescing keyed by id: concurrent callers with the same key attach to the same
 * in-flight future and the task body runs once. The key is released when the task finishes,
 * so a later call starts a fresh execution.
 */
public class SingleFlightManager {

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inflight = new ConcurrentHashMap<>();
    private final Executor exec;

    public SingleFlightManager(Executor exec) {
        this.exec = exec;
    }

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> submit(String key, Callable<T> task) {
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = inflight.putIfAbsent(key, created);
        if (existing != null) {
            return (CompletableFuture<T>) existing;
        }
        // Submitted only after the mapping is installed, so a fast task cannot leave a stale entry.
        try {
            exec.execute(() -> {
                Object value = null;
                Throwable failure = null;
                try {
                    value = task.call();
                } catch (Throwable t) {
                    // Errors included: the shared future must always complete.
                    failure = t;
                }
                // Released before completion so a woken caller never sees a stale key.
                inflight.remove(key, created);
                if (failure != null) {
                    created.completeExceptionally(failure);
                } else {
                    created.complete(value);
                }
            });
        } catch (RejectedExecutionException rejected) {
            inflight.remove(key, created);
            created.completeExceptionally(rejected);
        }
        return (CompletableFuture<T>) created;
    }

    public <T> T run(String key, Callable<T> task) throws Exception {
        try {
            return this.<T>submit(key, task).get();
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw new CompletionException(cause);
        }
    }

    public boolean isInFlight(String key) {
        return key != null && inflight.containsKey(key);
    }

    public Set<String> inFlightKeys() {
        return Set.copyOf(inflight.keySet());
    }
}
