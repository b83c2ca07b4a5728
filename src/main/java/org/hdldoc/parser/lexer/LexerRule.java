package org.hdldoc.parser.lexer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single scanning rule of a lexical state.
 *
 * @param pattern The pattern, matched anchored at the current cursor.
 * @param action The action emitted on a match, or {@code null} for a silent rule.
 * @param transition The state change applied after a match.
 * @param <S> The state type of the lexer.
 * @param <A> The action type of the lexer.
 */
public record LexerRule<S, A>(Pattern pattern, A action, Transition<S> transition) {

    public LexerRule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(transition, "transition");
    }

    /**
     * Silent rules advance the cursor (and may change state) without emitting anything.
     * @return {@code true} if this rule carries no action.
     */
    public boolean isSilent() {
        return action == null;
    }

    @Override
    public String toString() {
        return String.format("/%s/ -> %s, %s", pattern.pattern(), isSilent() ? "-" : action, transition);
    }
}
