package NFA2DFA.Model;

import java.util.List;

/**
 * Raw fields of an automaton description, as read from text. Nothing is validated here;
 * {@link Nfa#of(NfaDefinition)} does that.
 *
 * @param stateCount     declared number of states
 * @param states         state names in declaration order
 * @param symbolCount    declared number of symbols
 * @param symbols        symbols in declaration order
 * @param startState     name of the start state
 * @param acceptingCount declared number of accepting states
 * @param acceptingStates accepting state names
 * @param transitionCount declared number of transitions
 * @param transitions    transitions in input order
 */
public record NfaDefinition(int stateCount, List<String> states,
                            int symbolCount, List<String> symbols,
                            String startState,
                            int acceptingCount, List<String> acceptingStates,
                            int transitionCount, List<Transition> transitions) {

    public NfaDefinition {
        states = List.copyOf(states);
        symbols = List.copyOf(symbols);
        acceptingStates = List.copyOf(acceptingStates);
        transitions = List.copyOf(transitions);
    }

    /**
     * Convenience for callers that build definitions by hand: every count matches its list.
     */
    public static NfaDefinition of(List<String> states, List<String> symbols, String startState,
                                   List<String> acceptingStates, List<Transition> transitions) {
        return new NfaDefinition(states.size(), states, symbols.size(), symbols, startState,
            acceptingStates.size(), acceptingStates, transitions.size(), transitions);
    }

    public record Transition(String fromState, String symbol, String toState) {
        @Override
        public String toString() {
            return fromState + " " + symbol + " " + toState;
        }
    }
}
