package dev.evalbench.session;

/** Lifecycle status of an {@link EvaluationSession}. */
public enum SessionStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED,
    FAILED;

    /** A submission is outstanding: a new start must be refused. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
