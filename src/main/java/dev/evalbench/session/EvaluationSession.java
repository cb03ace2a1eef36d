package dev.evalbench.session;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of the current bulk run.
 *
 * <p>Produced by {@link SessionReducer}; each transition yields a new record.
 *
 * @param id                        correlation id of the run, null while idle
 * @param status                    lifecycle status
 * @param total                     number of questions submitted
 * @param batchSize                 parallelism hint sent with the submission
 * @param currentIndex              highest question index reported by progress events
 * @param progressPercent           last reported progress, 0 to 100
 * @param startTime                 when the run started
 * @param completedAt               when the run reached COMPLETED or FAILED
 * @param estimatedRemainingSeconds rough time left, a heuristic
 * @param error                     session-level failure message when FAILED
 */
public record EvaluationSession(
        @Nullable String id,
        SessionStatus status,
        int total,
        int batchSize,
        int currentIndex,
        double progressPercent,
        @Nullable Instant startTime,
        @Nullable Instant completedAt,
        double estimatedRemainingSeconds,
        @Nullable String error
) {

    public static EvaluationSession idle() {
        return new EvaluationSession(null, SessionStatus.IDLE, 0, 0, 0, 0.0, null, null, 0.0, null);
    }

    EvaluationSession withStatus(SessionStatus newStatus) {
        return new EvaluationSession(id, newStatus, total, batchSize, currentIndex,
                progressPercent, startTime, completedAt, estimatedRemainingSeconds, error);
    }

    EvaluationSession withProgress(int index, double percent, double remainingSeconds) {
        return new EvaluationSession(id, status, total, batchSize, index,
                percent, startTime, completedAt, remainingSeconds, error);
    }

    EvaluationSession completed(Instant at) {
        return new EvaluationSession(id, SessionStatus.COMPLETED, total, batchSize,
                Math.max(currentIndex, total), 100.0, startTime, at, 0.0, null);
    }

    EvaluationSession failed(String message, Instant at) {
        return new EvaluationSession(id, SessionStatus.FAILED, total, batchSize, currentIndex,
                progressPercent, startTime, at, 0.0, message);
    }

    /** Cancelled runs keep their id and batch size but reset every counter. */
    EvaluationSession cancelled() {
        return new EvaluationSession(id, SessionStatus.CANCELLED, 0, batchSize, 0,
                0.0, null, null, 0.0, null);
    }
}
