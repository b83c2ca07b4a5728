package org.hdldoc.parser.lexer;

import java.util.Objects;

/**
 * The state change applied by a {@link LexerRule} after it matched.
 * <p>
 * The set of transitions is closed: a rule either pushes a named state onto the
 * lexer's state stack, pops the current state, or leaves the stack untouched.
 *
 * @param kind The kind of the transition.
 * @param target The state to push; only set for {@link Kind#PUSH}.
 * @param <S> The state type of the lexer.
 */
public record Transition<S>(Kind kind, S target) {

    /**
     * The kinds of state changes a rule can request.
     */
    public enum Kind {
        /** Pushes {@link Transition#target()} onto the state stack. */
        PUSH,
        /** Pops the current state from the state stack. */
        POP,
        /** Keeps the current state. */
        STAY
    }

    private static final Transition<?> POP = new Transition<>(Kind.POP, null);
    private static final Transition<?> STAY = new Transition<>(Kind.STAY, null);

    public Transition {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.PUSH && target == null) {
            throw new IllegalArgumentException("A push transition needs a target state");
        }
        if (kind != Kind.PUSH && target != null) {
            throw new IllegalArgumentException("Only a push transition may name a target state");
        }
    }

    /**
     * Creates a transition that pushes the given state.
     * @param state The state to enter.
     * @param <S> The state type.
     * @return The push transition.
     */
    public static <S> Transition<S> push(S state) {
        return new Transition<>(Kind.PUSH, state);
    }

    /**
     * @param <S> The state type.
     * @return The transition that returns to the enclosing state.
     */
    @SuppressWarnings("unchecked")
    public static <S> Transition<S> pop() {
        return (Transition<S>) POP;
    }

    /**
     * @param <S> The state type.
     * @return The transition that keeps the current state.
     */
    @SuppressWarnings("unchecked")
    public static <S> Transition<S> stay() {
        return (Transition<S>) STAY;
    }

    @Override
    public String toString() {
        return kind == Kind.PUSH ? "push(" + target + ")" : kind.name().toLowerCase();
    }
}
