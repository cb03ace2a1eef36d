package dev.evalbench.session;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of reducing one command.
 *
 * @param state     the new state (the old one when rejected or ignored)
 * @param effects   side effects to run, in order
 * @param rejection the error to report to the caller, null when the command was accepted
 */
public record Transition(
        SessionState state,
        List<SessionEffect> effects,
        @Nullable RuntimeException rejection
) {

    public Transition {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    static Transition to(SessionState state, SessionEffect... effects) {
        return new Transition(state, List.of(effects), null);
    }

    static Transition unchanged(SessionState state) {
        return new Transition(state, List.of(), null);
    }

    static Transition rejected(SessionState state, RuntimeException rejection) {
        return new Transition(state, List.of(), rejection);
    }

    public boolean accepted() {
        return rejection == null;
    }
}
