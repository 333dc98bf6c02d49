package com.example.governance.coordination;

import com.example.governance.FakeAgentTransport;
import com.example.governance.MutableClock;
import com.example.governance.RecordingActionExecutor;
import com.example.governance.error.ErrorContext;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;
import com.example.governance.recovery.RecoveryResult;
import com.example.governance.recovery.SuccessCriteria;
import com.example.governance.recovery.action.RecoveryActionExecutor;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class RecoveryPlanExecutorTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final FakeAgentTransport transport = new FakeAgentTransport();
    private final RecoveryPlanFactory factory = new RecoveryPlanFactory(clock);

    @Test
    void abortStopsAtNextAction() {
        ErrorContext error = ErrorContext.of("e1", "agent-1", "worker");
        RecoveryCoordinationSession session = session(error, List.of("agent-1", "agent-2"));
        List<String> executed = new ArrayList<>();
        RecoveryActionExecutor aborting = (action, target) -> {
            executed.add(action.actionId());
            if (action.actionId().equals("activate_circuit_breakers")) {
                session.transitionTo(CoordinationStatus.ABORTED, clock.instant());
            }
            return CompletableFuture.completedFuture(null);
        };
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(aborting, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session, session.recoveryPlan(), e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(RecoveryPlanExecutor.ABORTED_MESSAGE);
        assertThat(result.rollbackRequired()).isFalse();
        assertThat(executed).containsExactly("assess_system_state", "activate_circuit_breakers");
    }

    @Test
    void unhealthyAssignedAgentFailsVerification() {
        transport.unhealthy("agent-2");
        ErrorContext error = ErrorContext.of("e1", "agent-1", "worker");
        RecoveryCoordinationSession session = session(error, List.of("agent-1", "agent-2"));
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(new RecordingActionExecutor(), transport,
                Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session, session.recoveryPlan(), e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.sideEffects()).containsExactly("Health check failed for agent agent-2");
        assertThat(result.actionsExecuted()).hasSize(6);
    }

    @Test
    void customCheckFailureIsReported() {
        ErrorContext error = ErrorContext.of("e1", "agent-1", "worker");
        RecoveryCoordinationSession session = session(error, List.of("agent-1"));
        RecoveryPlan plan = session.recoveryPlan();
        RecoveryPlan checked = new RecoveryPlan(plan.planId(), plan.phases(), plan.dependencies(), plan.rollbackPlan(),
                plan.estimatedDurationMs(), SuccessCriteria.healthCheck(false).withCustomChecks(List.of(
                        new SuccessCriteria.CustomCheck("queue_drained", "work queue is empty", e -> CompletableFuture.completedFuture(false)))));
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(new RecordingActionExecutor(), transport,
                Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session, checked, e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Custom check failed: queue_drained");
    }

    @Test
    void eventsAreRecordedPerPhaseAndAction() {
        ErrorContext error = ErrorContext.of("e1", "agent-1", "worker");
        RecoveryCoordinationSession session = session(error, List.of("agent-1"));
        List<CoordinationEvent> recorded = new ArrayList<>();
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(new RecordingActionExecutor(), transport,
                Duration.ofSeconds(1), clock);

        executor.execute(session, session.recoveryPlan(), recorded::add);

        // 4 phases x (started + completed) + 6 actions x (started + completed)
        assertThat(recorded).hasSize(20);
        assertThat(recorded).filteredOn(e -> "enable_degraded_mode".equals(e.actionId()))
                .extracting(CoordinationEvent::status)
                .containsExactly(CoordinationEvent.Status.STARTED, CoordinationEvent.Status.COMPLETED);
    }

    @Test
    void restartsGoToNamedAgentOthersToLeaderOrFirstAssigned() {
        RecoveryPhase phase = new RecoveryPhase("p", "p", "p", List.of("agent-2", "agent-3"), List.of(), 1_000L,
                null, false);
        RecoveryAction restart = RecoveryAction.of("r", RecoveryActionType.RESTART_AGENT, "r",
                new RecoveryActionParams.AgentRestart("agent-7", null), 1_000L);
        RecoveryAction cache = RecoveryAction.of("c", RecoveryActionType.CLEAR_CACHE, "c",
                new RecoveryActionParams.Generic(Map.of()), 1_000L);

        assertThat(RecoveryPlanExecutor.targetFor(restart, phase, "agent-1")).isEqualTo("agent-7");
        assertThat(RecoveryPlanExecutor.targetFor(cache, phase, "agent-3")).isEqualTo("agent-3");
        assertThat(RecoveryPlanExecutor.targetFor(cache, phase, "agent-1")).isEqualTo("agent-2");
    }

    @Test
    void phasesRunInDependencyOrderWhateverTheListOrder() {
        RecoveryPlan plan = new RecoveryPlan("plan-deps",
                List.of(phase("verify", step("check")), phase("prepare", step("assess")), phase("repair", step("fix"))),
                List.of(new PhaseDependency("verify", List.of("repair"), PhaseDependency.Type.SEQUENTIAL),
                        new PhaseDependency("repair", List.of("prepare"), PhaseDependency.Type.SEQUENTIAL)),
                null, 0L, null);
        RecordingActionExecutor actions = new RecordingActionExecutor();
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(actions, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(1)), plan, e -> { });

        assertThat(result.success()).isTrue();
        assertThat(actions.executed()).containsExactly("assess", "fix", "check");
    }

    @Test
    void actionsWaitForTheirDependenciesWithinAPhase() {
        RecoveryAction restore = new RecoveryAction("restore", RecoveryActionType.FALLBACK_MODE, "restore",
                new RecoveryActionParams.Generic(Map.of()), 1_000L, List.of("verify"));
        RecoveryPlan plan = new RecoveryPlan("plan-actions", List.of(phase("p", restore, step("verify"))),
                List.of(), null, 0L, null);
        RecordingActionExecutor actions = new RecordingActionExecutor();
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(actions, transport, Duration.ofSeconds(1), clock);

        executor.execute(session(plan, fastRetry(1)), plan, e -> { });

        assertThat(actions.executed()).containsExactly("verify", "restore");
    }

    @Test
    void phaseCycleFailsBeforeAnyAction() {
        RecoveryPlan plan = new RecoveryPlan("plan-cycle", List.of(phase("a", step("x")), phase("b", step("y"))),
                List.of(new PhaseDependency("a", List.of("b"), null), new PhaseDependency("b", List.of("a"), null)),
                null, 0L, null);
        RecordingActionExecutor actions = new RecordingActionExecutor();
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(actions, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(1)), plan, e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("phase dependency cycle among [a, b]");
        assertThat(actions.executed()).isEmpty();
    }

    @Test
    void dependencyOnMissingPhaseFailsBeforeAnyAction() {
        RecoveryPlan plan = new RecoveryPlan("plan-missing", List.of(phase("a", step("x"))),
                List.of(new PhaseDependency("a", List.of("ghost"), null)), null, 0L, null);
        RecordingActionExecutor actions = new RecordingActionExecutor();
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(actions, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(1)), plan, e -> { });

        assertThat(result.error()).contains("phase a depends on unknown phase ghost");
        assertThat(actions.executed()).isEmpty();
    }

    @Test
    void transientFailureIsRetriedUntilItSucceeds() {
        RecoveryPlan plan = singleStepPlan("flaky");
        AtomicInteger calls = new AtomicInteger();
        RecoveryActionExecutor flaky = (action, target) -> calls.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new ConnectException("connection refused"))
                : CompletableFuture.completedFuture(null);
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(flaky, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(3)), plan, e -> { });

        assertThat(result.success()).isTrue();
        assertThat(calls).hasValue(3);
        assertThat(result.actionsExecuted()).extracting(RecoveryAction::actionId).containsExactly("flaky");
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        RecoveryPlan plan = singleStepPlan("broken");
        AtomicInteger calls = new AtomicInteger();
        RecoveryActionExecutor broken = (action, target) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("bad config"));
        };
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(broken, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(3)), plan, e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Phase p failed").endsWith("bad config");
        assertThat(calls).hasValue(1);
    }

    @Test
    void abortDuringBackoffStopsRetrying() {
        RecoveryPlan plan = singleStepPlan("flaky");
        RecoveryCoordinationSession session = session(plan, fastRetry(3));
        AtomicInteger calls = new AtomicInteger();
        RecoveryActionExecutor abortingFailure = (action, target) -> {
            calls.incrementAndGet();
            session.transitionTo(CoordinationStatus.ABORTED, clock.instant());
            return CompletableFuture.failedFuture(new ConnectException("connection refused"));
        };
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(abortingFailure, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session, plan, e -> { });

        assertThat(result.error()).isEqualTo(RecoveryPlanExecutor.ABORTED_MESSAGE);
        assertThat(result.rollbackRequired()).isFalse();
        assertThat(calls).hasValue(1);
    }

    @Test
    void phaseDeadlineStopsRemainingActions() {
        RecoveryPlan plan = new RecoveryPlan("plan-slow", List.of(phase("p", step("first"), step("second"))),
                List.of(), null, 0L, null);
        List<String> executed = new ArrayList<>();
        RecoveryActionExecutor slow = (action, target) -> {
            executed.add(action.actionId());
            clock.advance(Duration.ofSeconds(2));
            return CompletableFuture.completedFuture(null);
        };
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(slow, transport, Duration.ofSeconds(1), clock);

        RecoveryResult result = executor.execute(session(plan, fastRetry(1)), plan, e -> { });

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Phase p failed: timeout of 1000ms exceeded");
        assertThat(executed).containsExactly("first");
    }

    @Test
    void retryIsSkippedWhenBackoffWouldPassPhaseDeadline() {
        RecoveryPlan plan = singleStepPlan("flaky");
        AtomicInteger calls = new AtomicInteger();
        RecoveryActionExecutor flaky = (action, target) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new ConnectException("connection refused"));
        };
        RecoveryPlanExecutor executor = new RecoveryPlanExecutor(flaky, transport, Duration.ofSeconds(1), clock);
        RetryPolicy slowBackoff = new RetryPolicy(3, BackoffStrategy.FIXED, 5_000L, 5_000L);

        RecoveryResult result = executor.execute(session(plan, slowBackoff), plan, e -> { });

        assertThat(result.success()).isFalse();
        assertThat(calls).hasValue(1);
    }

    private RecoveryPlan singleStepPlan(String actionId) {
        return new RecoveryPlan("plan-" + actionId, List.of(phase("p", step(actionId))), List.of(), null, 0L, null);
    }

    private static RecoveryPhase phase(String id, RecoveryAction... actions) {
        return new RecoveryPhase(id, id, id, List.of("agent-1"), List.of(actions), 1_000L, null, false);
    }

    private static RecoveryAction step(String id) {
        return RecoveryAction.of(id, RecoveryActionType.CLEAR_CACHE, id, new RecoveryActionParams.Generic(Map.of()), 500L);
    }

    private static RetryPolicy fastRetry(int attempts) {
        return new RetryPolicy(attempts, BackoffStrategy.FIXED, 1L, 1L);
    }

    private RecoveryCoordinationSession session(RecoveryPlan plan, RetryPolicy retry) {
        CoordinationStrategy strategy = new CoordinationStrategy(CoordinationType.HIERARCHICAL,
                LeaderElectionMethod.FIXED, null, 600_000L, retry);
        RecoveryCoordinationSession session = new RecoveryCoordinationSession("s2", ErrorContext.of("e2", "agent-1", "worker"),
                List.of("agent-1"), strategy, plan, clock.instant());
        session.transitionTo(CoordinationStatus.EXECUTING, clock.instant());
        session.assignLeader("agent-1");
        return session;
    }

    private RecoveryCoordinationSession session(ErrorContext error, List<String> agents) {
        RecoveryCoordinationSession session = new RecoveryCoordinationSession("s1", error, agents,
                CoordinationStrategy.hierarchical(), factory.createPlan(error, agents), clock.instant());
        session.transitionTo(CoordinationStatus.EXECUTING, clock.instant());
        session.assignLeader(agents.get(0));
        return session;
    }
}
