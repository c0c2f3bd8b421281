package com.trellissystems.work;

/**
 * Lifecycle of a {@link Work} item. Transitions only move forward:
 * {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}.
 */
public enum WorkStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks whether this status may be followed by another.
     *
     * @param next the candidate status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(WorkStatus next) {
        switch (this) {
            case PENDING:
                return next == IN_PROGRESS;
            case IN_PROGRESS:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
