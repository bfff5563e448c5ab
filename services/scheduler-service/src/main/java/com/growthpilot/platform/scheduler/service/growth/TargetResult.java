package com.growthpilot.platform.scheduler.service.growth;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class TargetResult {

    private final TargetOutcome outcome;
    private final int actionsPerformed;
    /** The platform throttled this user; the rest of the strategy's cycle should stop. */
    private final boolean rateLimited;

    public static TargetResult of(TargetOutcome outcome, int actionsPerformed) {
        return new TargetResult(outcome, actionsPerformed, false);
    }
}
