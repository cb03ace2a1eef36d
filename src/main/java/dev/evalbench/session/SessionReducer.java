package dev.evalbench.session;

import dev.evalbench.evaluation.EvaluationException;
import dev.evalbench.evaluation.EvaluationException.ErrorKind;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.session.SessionCommand.Cancel;
import dev.evalbench.session.SessionCommand.Clear;
import dev.evalbench.session.SessionCommand.Log;
import dev.evalbench.session.SessionCommand.Pause;
import dev.evalbench.session.SessionCommand.Progress;
import dev.evalbench.session.SessionCommand.Result;
import dev.evalbench.session.SessionCommand.Resume;
import dev.evalbench.session.SessionCommand.RunScoped;
import dev.evalbench.session.SessionCommand.Start;
import dev.evalbench.session.SessionCommand.SubmissionFailed;
import dev.evalbench.session.SessionCommand.SummaryReceived;
import dev.evalbench.stream.ProgressEvent;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure transition function of the evaluation session state machine.
 *
 * <pre>
 * IDLE | COMPLETED | CANCELLED | FAILED --start--> RUNNING
 * RUNNING --pause--> PAUSED --resume--> RUNNING
 * RUNNING | PAUSED --summary--> COMPLETED
 * RUNNING | PAUSED --failure--> FAILED
 * RUNNING | PAUSED --cancel--> CANCELLED
 * IDLE | COMPLETED | CANCELLED | FAILED --clear--> IDLE
 * </pre>
 *
 * <p>Invalid caller commands are rejected. Events of a run that is not the current one, or that
 * arrive once the run is no longer active, are ignored.
 */
public final class SessionReducer {

    private static final Logger log = LoggerFactory.getLogger(SessionReducer.class);

    private SessionReducer() {
        // utility class
    }

    public static Transition reduce(SessionState state, SessionCommand command) {
        if (command instanceof RunScoped scoped && !isCurrent(state, scoped.correlationId())) {
            return Transition.unchanged(state);
        }
        if (command instanceof Start start) {
            return start(state, start);
        }
        if (command instanceof Pause) {
            return pause(state);
        }
        if (command instanceof Resume) {
            return resume(state);
        }
        if (command instanceof Cancel) {
            return cancel(state);
        }
        if (command instanceof Clear) {
            return clear(state);
        }
        if (command instanceof Progress progress) {
            return progress(state, progress.event());
        }
        if (command instanceof Result result) {
            return result(state, result);
        }
        if (command instanceof Log logLine) {
            return appendLog(state, logLine);
        }
        if (command instanceof SummaryReceived summary) {
            return summary(state, summary);
        }
        if (command instanceof SubmissionFailed failure) {
            return failure(state, failure);
        }
        throw new IllegalArgumentException("Unknown session command: " + command);
    }

    private static Transition start(SessionState state, Start start) {
        SessionStatus status = state.session().status();
        if (status.isActive()) {
            return Transition.rejected(state, new EvaluationException(ErrorKind.SESSION_CONFLICT,
                    "A bulk evaluation is already " + status.name().toLowerCase(Locale.ROOT)
                            + "; cancel it before starting another"));
        }
        if (!start.dataset().isValid()) {
            return Transition.rejected(state, new EvaluationException(ErrorKind.INVALID_INPUT,
                    "Dataset is invalid: " + String.join("; ", start.dataset().errors())));
        }
        EvaluationSession session = new EvaluationSession(
                start.correlationId(),
                SessionStatus.RUNNING,
                start.dataset().size(),
                start.config().batchSize(),
                0,
                0.0,
                start.startedAt(),
                null,
                start.estimatedRemainingSeconds(),
                null);
        SessionState next = new SessionState(
                session, start.dataset(), start.config(), null, null, state.logCapacity());
        return Transition.to(next,
                new SessionEffect.Subscribe(start.correlationId()),
                new SessionEffect.SubmitBatch(start.dataset(), start.config()));
    }

    private static Transition pause(SessionState state) {
        if (state.session().status() != SessionStatus.RUNNING) {
            return illegal(state, "pause");
        }
        return Transition.to(state.withSession(state.session().withStatus(SessionStatus.PAUSED)));
    }

    private static Transition resume(SessionState state) {
        if (state.session().status() != SessionStatus.PAUSED) {
            return illegal(state, "resume");
        }
        return Transition.to(state.withSession(state.session().withStatus(SessionStatus.RUNNING)));
    }

    private static Transition cancel(SessionState state) {
        EvaluationSession session = state.session();
        if (!session.status().isActive()) {
            return illegal(state, "cancel");
        }
        SessionState next = state.withResults(session.cancelled(), List.of());
        return Transition.to(next,
                new SessionEffect.Unsubscribe(session.id()),
                new SessionEffect.AbortRemote(session.id()));
    }

    private static Transition clear(SessionState state) {
        EvaluationSession session = state.session();
        if (session.status().isActive()) {
            return illegal(state, "clear");
        }
        SessionState next = SessionState.initial(state.logCapacity());
        if (session.id() == null) {
            return Transition.to(next);
        }
        return Transition.to(next, new SessionEffect.Unsubscribe(session.id()));
    }

    private static Transition progress(SessionState state, ProgressEvent event) {
        EvaluationSession session = state.session();
        if (session.status() != SessionStatus.RUNNING) {
            return Transition.unchanged(state);
        }
        int index = Math.max(session.currentIndex(), event.currentQuestionIndex());
        double percent = Math.max(0.0, Math.min(100.0, event.progressPercent()));
        double remaining = Math.max(0.0, event.estimatedTimeRemainingSeconds());
        return Transition.to(state.withSession(session.withProgress(index, percent, remaining)));
    }

    private static Transition result(SessionState state, Result result) {
        if (!state.session().status().isActive()) {
            return Transition.unchanged(state);
        }
        int index = result.event().questionIndex();
        if (index < 0 || index >= state.session().total()) {
            log.debug("Dropped result for question {} outside [0, {})", index, state.session().total());
            return Transition.unchanged(state);
        }
        return Transition.to(state.withResult(result.event().toResult(state.expectedAnswerAt(index))));
    }

    private static Transition appendLog(SessionState state, Log logLine) {
        if (!state.session().status().isActive()) {
            return Transition.unchanged(state);
        }
        return Transition.to(state.withLog(logLine.line()));
    }

    private static Transition summary(SessionState state, SummaryReceived received) {
        EvaluationSession session = state.session();
        if (!session.status().isActive()) {
            return Transition.unchanged(state);
        }
        List<EvaluationResult> results = received.summary().results().stream()
                .map(r -> r.expectedAnswer() != null
                        ? r
                        : r.withExpectedAnswer(state.expectedAnswerAt(r.questionIndex())))
                .toList();
        SessionState next = state.withResults(session.completed(received.at()), results);
        return Transition.to(next, new SessionEffect.Unsubscribe(session.id()));
    }

    private static Transition failure(SessionState state, SubmissionFailed failed) {
        EvaluationSession session = state.session();
        if (!session.status().isActive()) {
            return Transition.unchanged(state);
        }
        SessionState next = state.withSession(session.failed(failed.message(), failed.at()));
        return Transition.to(next, new SessionEffect.Unsubscribe(session.id()));
    }

    private static boolean isCurrent(SessionState state, String correlationId) {
        return correlationId != null && correlationId.equals(state.session().id());
    }

    private static Transition illegal(SessionState state, String action) {
        return Transition.rejected(state, new IllegalStateException(
                "Cannot " + action + " a session that is "
                        + state.session().status().name().toLowerCase(Locale.ROOT)));
    }
}
