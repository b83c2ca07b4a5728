package org.hdldoc.parser.lexer;

import java.util.List;

/**
 * An action emitted by the {@link MiniLexer}.
 *
 * @param position The offset in the input where the matched text starts.
 * @param action The action of the rule that matched.
 * @param groups The captured groups of the match, in group order. Groups that did not
 *               participate in the match are {@code null}.
 * @param <A> The action type.
 */
public record LexerMatch<A>(int position, A action, List<String> groups) {

    /**
     * Returns a captured group.
     * @param index The zero-based index into {@link #groups()}, i.e. regex group {@code index + 1}.
     * @return The captured text, or {@code null} if the group did not participate.
     */
    public String group(int index) {
        return groups.get(index);
    }
}
