package org.hdldoc.parser.lexer;

import java.util.Objects;

/**
 * A small table-driven lexer with a state stack.
 * <p>
 * The lexer knows nothing about any particular language: all of its behavior comes from
 * the {@link RuleTable} it is given. At every position it tries the rules of the state on
 * top of the stack in order and commits to the first one that matches. A rule may emit an
 * action with the captured groups of its match, and may push a new state or pop the
 * current one. Nested constructs such as block comments are therefore handled purely by
 * pushing a dedicated state from whichever state is active.
 * <p>
 * A {@code MiniLexer} is stateless and can be reused; every call to {@link #run(String)}
 * produces an independent {@link TokenStream}.
 *
 * @param <S> The enumerated state type.
 * @param <A> The action type.
 */
public final class MiniLexer<S extends Enum<S>, A> {

    private final RuleTable<S, A> table;

    /**
     * Creates a lexer for the given rule table.
     * @param table The states and rules to scan with.
     */
    public MiniLexer(RuleTable<S, A> table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Starts scanning a text. Nothing is scanned until the returned stream is iterated.
     * @param text The input text.
     * @return A lazy, single-pass stream of the actions found in the text.
     */
    public TokenStream<S, A> run(String text) {
        return new TokenStream<>(table, Objects.requireNonNull(text, "text"));
    }

    public RuleTable<S, A> table() {
        return table;
    }
}
