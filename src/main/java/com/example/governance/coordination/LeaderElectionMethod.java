package com.example.governance.coordination;

import java.util.Locale;

public enum LeaderElectionMethod {
    /** First participating agent. */
    FIXED,
    /** Most ballots cast by the participants. */
    VOTING,
    /** Highest reported capability score. */
    DYNAMIC;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
