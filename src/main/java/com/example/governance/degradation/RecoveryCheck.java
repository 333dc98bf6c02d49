package com.example.governance.degradation;

import java.util.List;

/** Outcome of the pre-recovery checks; {@code reasons} lists every unmet condition. */
public record RecoveryCheck(boolean allowed, List<String> reasons) {

    public RecoveryCheck {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
