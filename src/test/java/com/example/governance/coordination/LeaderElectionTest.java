package com.example.governance.coordination;

import com.example.governance.FakeAgentTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LeaderElectionTest {

    private final FakeAgentTransport transport = new FakeAgentTransport();
    private final LeaderElection election = new LeaderElection(transport, Duration.ofSeconds(1));
    private final List<String> agents = List.of("a", "b", "c", "d");

    @Test
    void centralizedAndFixedPickFirstAgent() {
        assertThat(election.electLeader(agents, CoordinationStrategy.centralized())).isEqualTo("a");
        assertThat(election.electLeader(agents, CoordinationStrategy.hierarchical())).isEqualTo("a");
    }

    @Test
    void votingPicksMostBallots() {
        transport.ballot("a", "c").ballot("b", "c").ballot("c", "b").ballot("d", "c");

        assertThat(election.electLeader(agents, CoordinationStrategy.consensus(3))).isEqualTo("c");
    }

    @Test
    void votingTieGoesToEarlierCandidate() {
        transport.ballot("a", "d").ballot("b", "b").ballot("c", "d").ballot("d", "b");

        assertThat(election.byVoting(agents)).isEqualTo("b");
    }

    @Test
    void ballotsForStrangersAreIgnored() {
        transport.ballot("a", "x").ballot("b", "x").ballot("c", "x").ballot("d", "d");

        assertThat(election.byVoting(agents)).isEqualTo("d");
    }

    @Test
    void dynamicPicksHighestCapabilityAndSkipsMissingScores() {
        transport.score("b", 0.4).score("c", 0.9).score("d", 0.9);

        CoordinationStrategy dynamic = new CoordinationStrategy(CoordinationType.DISTRIBUTED,
                LeaderElectionMethod.DYNAMIC, null, 60_000L, new RetryPolicy(1, BackoffStrategy.FIXED, 0L, 0L));
        assertThat(election.electLeader(agents, dynamic)).isEqualTo("c");
    }

    @Test
    void noScoresFallsBackToFirstAgent() {
        assertThat(election.byCapability(agents)).isEqualTo("a");
    }

    @Test
    void emptyAgentListIsRejected() {
        assertThatThrownBy(() -> election.electLeader(List.of(), CoordinationStrategy.centralized()))
                .isInstanceOf(CoordinationException.class);
    }
}
