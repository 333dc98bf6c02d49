package com.example.governance.coordination;

/**
 * @param leaderElectionMethod null for centralized coordination (the initiator leads)
 * @param decisionThreshold    approvals needed for the plan to run unchanged; consensus only
 */
public record CoordinationStrategy(CoordinationType type,
                                   LeaderElectionMethod leaderElectionMethod,
                                   Integer decisionThreshold,
                                   long timeoutMs,
                                   RetryPolicy retryPolicy) {

    public static CoordinationStrategy centralized() {
        return new CoordinationStrategy(CoordinationType.CENTRALIZED, null, null, 300_000L,
                new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, 1_000L, 10_000L));
    }

    public static CoordinationStrategy hierarchical() {
        return new CoordinationStrategy(CoordinationType.HIERARCHICAL, LeaderElectionMethod.FIXED, null, 600_000L,
                new RetryPolicy(2, BackoffStrategy.LINEAR, 2_000L, 8_000L));
    }

    public static CoordinationStrategy consensus(int decisionThreshold) {
        return new CoordinationStrategy(CoordinationType.CONSENSUS, LeaderElectionMethod.VOTING, decisionThreshold,
                900_000L, new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, 3_000L, 15_000L));
    }
}
