package com.growthpilot.platform.scheduler.entity;

import java.util.Optional;

/**
 * Engagement actions and their inverses, with the daily quota bucket each one draws from.
 */
public enum ActionType {
    FOLLOW(QuotaAction.FOLLOW),
    UNFOLLOW(QuotaAction.UNFOLLOW),
    LIKE(QuotaAction.LIKE),
    UNLIKE(null),
    RETWEET(QuotaAction.RETWEET),
    UNRETWEET(null),
    REPLY(QuotaAction.REPLY),
    POST(QuotaAction.POST);

    private final QuotaAction quotaAction;

    ActionType(QuotaAction quotaAction) {
        this.quotaAction = quotaAction;
    }

    public Optional<QuotaAction> quotaAction() {
        return Optional.ofNullable(quotaAction);
    }

    public Optional<ActionType> inverse() {
        return switch (this) {
            case FOLLOW -> Optional.of(UNFOLLOW);
            case LIKE -> Optional.of(UNLIKE);
            case RETWEET -> Optional.of(UNRETWEET);
            default -> Optional.empty();
        };
    }
}
