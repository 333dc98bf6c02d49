package com.example.governance.resilience;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SingleFlightManagerTest {

    private final ExecutorService exec = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    @Test
    void concurrentCallersShareOneExecution() throws Exception {
        SingleFlightManager sf = new SingleFlightManager(exec);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        CompletableFuture<String> a = sf.submit("err-1", () -> {
            runs.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        });
        CompletableFuture<String> b = sf.submit("err-1", () -> {
            runs.incrementAndGet();
            return "second";
        });
        release.countDown();

        assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(runs).hasValue(1);
    }

    @Test
    void keyIsReleasedAfterCompletion() throws Exception {
        SingleFlightManager sf = new SingleFlightManager(exec);
        AtomicInteger runs = new AtomicInteger();

        sf.run("k", runs::incrementAndGet);
        sf.run("k", runs::incrementAndGet);

        assertThat(runs).hasValue(2);
        assertThat(sf.isInFlight("k")).isFalse();
    }

    @Test
    void runRethrowsTaskException() {
        SingleFlightManager sf = new SingleFlightManager(exec);

        assertThatThrownBy(() -> sf.run("k", () -> {
            throw new IllegalStateException("nope");
        })).isInstanceOf(IllegalStateException.class).hasMessage("nope");
    }

    @Test
    void errorThrownByTaskFailsEveryAttachedCaller() {
        SingleFlightManager sf = new SingleFlightManager(exec);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> first = sf.submit("err-1", () -> {
            release.await(5, TimeUnit.SECONDS);
            throw new StackOverflowError("deep");
        });
        CompletableFuture<String> attached = sf.submit("err-1", () -> "never");
        release.countDown();

        assertThat(attached).isSameAs(first);
        assertThatThrownBy(() -> attached.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StackOverflowError.class);
        assertThat(sf.isInFlight("err-1")).isFalse();
    }
}
