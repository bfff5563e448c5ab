package com.growthpilot.platform.scheduler.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lifecycle of a scheduled tweet. DRAFT is never picked up by the dispatcher;
 * POSTED, FAILED and CANCELLED are terminal.
 */
public enum TweetStatus {
    DRAFT,
    PENDING,
    POSTING,
    RETRYING,
    POSTED,
    FAILED,
    CANCELLED;

    private static final Map<TweetStatus, Set<TweetStatus>> TRANSITIONS = new EnumMap<>(TweetStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(PENDING));
        TRANSITIONS.put(PENDING, EnumSet.of(POSTING, CANCELLED));
        // POSTING -> PENDING/RETRYING is a claim release (quota deferral)
        TRANSITIONS.put(POSTING, EnumSet.of(POSTED, RETRYING, FAILED, PENDING));
        TRANSITIONS.put(RETRYING, EnumSet.of(POSTING, CANCELLED));
        TRANSITIONS.put(POSTED, EnumSet.noneOf(TweetStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(TweetStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(TweetStatus.class));
    }

    public boolean canTransitionTo(TweetStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** Statuses the dispatcher may claim into POSTING. */
    public static Set<TweetStatus> claimable() {
        return sourcesOf(POSTING);
    }

    /** Statuses a user cancellation is honoured from. */
    public static Set<TweetStatus> cancellable() {
        return sourcesOf(CANCELLED);
    }

    private static Set<TweetStatus> sourcesOf(TweetStatus target) {
        return Collections.unmodifiableSet(Arrays.stream(values())
                .filter(s -> s.canTransitionTo(target))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(TweetStatus.class))));
    }
}
