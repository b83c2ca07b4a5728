package org.hdldoc.parser.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

/**
 * The lazy output of one {@link MiniLexer} run over a text.
 * <p>
 * The stream scans only as far as needed to produce the next match. It is single-pass:
 * it can be iterated exactly once and cannot be rewound. It is not thread-safe.
 * <p>
 * Scanning stops when the cursor reaches the end of the text, whatever the state stack
 * looks like; callers that require the text to end in the root state check
 * {@link #depth()} after exhausting the stream.
 *
 * @param <S> The state type.
 * @param <A> The action type.
 */
public final class TokenStream<S extends Enum<S>, A> implements Iterator<LexerMatch<A>>, Iterable<LexerMatch<A>> {

    private static final int SNIPPET_LENGTH = 20;

    private final RuleTable<S, A> table;
    private final String text;
    private final Deque<S> states = new ArrayDeque<>();
    private final Deque<Integer> openedAt = new ArrayDeque<>();
    private final Map<LexerRule<S, A>, Matcher> matchers = new IdentityHashMap<>();
    private int cursor = 0;
    private LexerMatch<A> next;
    private boolean iteratorTaken = false;

    TokenStream(RuleTable<S, A> table, String text) {
        this.table = table;
        this.text = text;
        states.push(table.rootState());
        openedAt.push(0);
    }

    @Override
    public Iterator<LexerMatch<A>> iterator() {
        if (iteratorTaken) {
            throw new IllegalStateException("A token stream can only be iterated once");
        }
        iteratorTaken = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        while (next == null && cursor < text.length()) {
            step();
        }
        return next != null;
    }

    @Override
    public LexerMatch<A> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        LexerMatch<A> match = next;
        next = null;
        return match;
    }

    /**
     * Drains the remaining matches into a list.
     * @return All matches not consumed yet.
     */
    public List<LexerMatch<A>> toList() {
        List<LexerMatch<A>> result = new ArrayList<>();
        forEachRemaining(result::add);
        return result;
    }

    /**
     * @return The number of states on the stack, 1 when only the root state is active.
     */
    public int depth() {
        return states.size();
    }

    public S currentState() {
        return states.peek();
    }

    /**
     * @return The offset at which the current state was entered, 0 for the root state.
     */
    public int currentStateOpenedAt() {
        return openedAt.peek();
    }

    /**
     * @return The states on the stack, innermost first.
     */
    public List<S> stateStack() {
        return List.copyOf(states);
    }

    public int position() {
        return cursor;
    }

    public boolean isAtEnd() {
        return cursor >= text.length();
    }

    private void step() {
        S state = states.peek();
        for (LexerRule<S, A> rule : table.rulesFor(state)) {
            Matcher matcher = matcherFor(rule);
            matcher.region(cursor, text.length());
            // empty matches never advance the cursor and are not taken
            if (!matcher.lookingAt() || matcher.end() == cursor) {
                continue;
            }
            int start = cursor;
            cursor = matcher.end();
            if (!rule.isSilent()) {
                next = new LexerMatch<>(start, rule.action(), groupsOf(matcher));
            }
            apply(rule.transition(), start);
            return;
        }
        throw new LexerException(
                String.format("No rule matches at offset %d in state %s near '%s'", cursor, state, snippet()),
                cursor, state.name());
    }

    private void apply(Transition<S> transition, int matchStart) {
        switch (transition.kind()) {
            case PUSH -> {
                states.push(transition.target());
                openedAt.push(matchStart);
            }
            case POP -> {
                if (states.size() == 1) {
                    throw new LexerException("Cannot pop the root state at offset " + matchStart,
                            matchStart, states.peek().name());
                }
                states.pop();
                openedAt.pop();
            }
            case STAY -> {
                // nothing to do
            }
        }
    }

    private Matcher matcherFor(LexerRule<S, A> rule) {
        return matchers.computeIfAbsent(rule, r -> {
            Matcher matcher = r.pattern().matcher(text);
            // lets \b and look-behinds see the text before the cursor
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            return matcher;
        });
    }

    private static List<String> groupsOf(Matcher matcher) {
        String[] groups = new String[matcher.groupCount()];
        for (int i = 0; i < groups.length; i++) {
            groups[i] = matcher.group(i + 1);
        }
        return Collections.unmodifiableList(Arrays.asList(groups));
    }

    private String snippet() {
        String rest = text.substring(cursor, Math.min(text.length(), cursor + SNIPPET_LENGTH));
        return rest.replace("\n", "\\n").replace("\r", "\\r");
    }
}
