package com.phonos.commerce.model;

/**
 * Status of one outbound store call. Each status carries a rank and a call only ever
 * moves to a strictly higher rank, so duplicate or late provider events are harmless.
 */
public enum StoreCallStatus {
    QUEUED(0),
    DIALING(1),
    IN_PROGRESS(2),
    COMPLETED(3),
    FAILED(5),
    ANALYZED(4),
    UNANALYZABLE(4);

    private final int rank;

    StoreCallStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * A settled call will not change again and counts towards {@code calls_completed}.
     */
    public boolean isSettled() {
        return this == FAILED || this == ANALYZED || this == UNANALYZABLE;
    }

    public boolean canTransitionTo(StoreCallStatus next) {
        if (next == null || isSettled()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        if (next == ANALYZED || next == UNANALYZABLE) {
            return this == COMPLETED;
        }
        return next.rank > this.rank;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
