package org.hdldoc.parser.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The configuration of a {@link MiniLexer}: for every lexical state the ordered list of
 * rules that are tried at the cursor, plus the root state the lexer starts in.
 * <p>
 * Rule order is significant, the first rule that matches wins. Tables are immutable
 * once built and can be shared between any number of lexer runs.
 *
 * @param <S> The enumerated state type.
 * @param <A> The action type.
 */
public final class RuleTable<S extends Enum<S>, A> {

    private final S rootState;
    private final Map<S, List<LexerRule<S, A>>> rules;

    private RuleTable(S rootState, Map<S, List<LexerRule<S, A>>> rules) {
        this.rootState = rootState;
        this.rules = rules;
    }

    /**
     * Starts a new table.
     * @param stateType The enum class of the states.
     * @param rootState The state the lexer starts in.
     * @param <S> The state type.
     * @param <A> The action type.
     * @return A builder for the table.
     */
    public static <S extends Enum<S>, A> Builder<S, A> builder(Class<S> stateType, S rootState) {
        return new Builder<>(stateType, rootState);
    }

    public S rootState() {
        return rootState;
    }

    /**
     * @param state A lexical state.
     * @return The rules of the state in match order, empty if the state has none.
     */
    public List<LexerRule<S, A>> rulesFor(S state) {
        return rules.getOrDefault(state, List.of());
    }

    /**
     * Builds a {@link RuleTable}. Rules are appended to their state in call order.
     *
     * @param <S> The state type.
     * @param <A> The action type.
     */
    public static final class Builder<S extends Enum<S>, A> {

        private final S rootState;
        private final Map<S, List<LexerRule<S, A>>> rules;

        private Builder(Class<S> stateType, S rootState) {
            this.rootState = Objects.requireNonNull(rootState, "rootState");
            this.rules = new EnumMap<>(stateType);
        }

        /**
         * Adds a rule.
         * @param state The state the rule belongs to.
         * @param regex The pattern.
         * @param action The emitted action, or {@code null} for a silent rule.
         * @param transition The state change after a match.
         * @return This builder.
         */
        public Builder<S, A> rule(S state, String regex, A action, Transition<S> transition) {
            rules.computeIfAbsent(state, s -> new ArrayList<>())
                    .add(new LexerRule<>(Pattern.compile(regex), action, transition));
            return this;
        }

        public Builder<S, A> emit(S state, String regex, A action) {
            return rule(state, regex, action, Transition.stay());
        }

        public Builder<S, A> emit(S state, String regex, A action, Transition<S> transition) {
            return rule(state, regex, action, transition);
        }

        public Builder<S, A> skip(S state, String regex) {
            return rule(state, regex, null, Transition.stay());
        }

        public Builder<S, A> skip(S state, String regex, Transition<S> transition) {
            return rule(state, regex, null, transition);
        }

        /**
         * Validates and freezes the table.
         * @return The immutable rule table.
         * @throws IllegalStateException if the root state or a pushed state has no rules.
         */
        public RuleTable<S, A> build() {
            if (!rules.containsKey(rootState)) {
                throw new IllegalStateException("Root state " + rootState + " has no rules");
            }
            for (List<LexerRule<S, A>> stateRules : rules.values()) {
                for (LexerRule<S, A> rule : stateRules) {
                    Transition<S> transition = rule.transition();
                    if (transition.kind() == Transition.Kind.PUSH && !rules.containsKey(transition.target())) {
                        throw new IllegalStateException("State " + transition.target() + " is pushed but has no rules");
                    }
                }
            }
            Map<S, List<LexerRule<S, A>>> frozen = new EnumMap<>(rules);
            frozen.replaceAll((state, stateRules) -> List.copyOf(stateRules));
            return new RuleTable<>(rootState, Collections.unmodifiableMap(frozen));
        }
    }
}
