package com.phonos.commerce.model;

/**
 * Lifecycle of a ticket's pipeline. Stages advance strictly in declaration order;
 * {@link #FAILED} is reachable from any non-terminal stage.
 */
public enum TicketStatus {
    RECEIVED,
    CLASSIFYING,
    ANALYZING,
    RESEARCHING,
    FINDING_STORES,
    CALLING_STORES,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns whether a ticket currently in this status may move to {@code next}: the
     * immediately following stage, or {@link #FAILED}. Skipping a stage, re-entering the same
     * status and moving backwards are all refused.
     */
    public boolean canTransitionTo(TicketStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == this.ordinal() + 1;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
