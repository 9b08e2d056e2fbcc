package NFA2DFA.Model;

import java.util.List;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Frozen result of the subset construction. State 0 is the initial state; states are numbered in
 * discovery order. The transition function is total.
 */
public final class SubsetDfa {
    public static final int NO_DEAD_STATE = -1;

    private final Alphabet<String> alphabet;
    private final List<SubsetState> states;
    private final int[][] transitions;
    private final int deadState;

    /**
     * @param alphabet - input alphabet, same as the NFA's
     * @param states - subset states, indexed by id
     * @param transitions - {@code transitions[state][symbolIndex]} is the successor id
     * @param deadState - id of the dead state or {@link #NO_DEAD_STATE}
     */
    public SubsetDfa(Alphabet<String> alphabet, List<SubsetState> states, int[][] transitions, int deadState) {
        if (states.size() != transitions.length) {
            throw new IllegalArgumentException(
                "Got " + states.size() + " states but " + transitions.length + " transition rows");
        }
        this.alphabet = alphabet;
        this.states = List.copyOf(states);
        this.transitions = new int[transitions.length][];
        for (int i = 0; i < transitions.length; i++) {
            if (transitions[i].length != alphabet.size()) {
                throw new IllegalArgumentException("Transition row " + i + " is not total");
            }
            this.transitions[i] = transitions[i].clone();
        }
        this.deadState = deadState;
    }

    public Alphabet<String> getInputAlphabet() {
        return alphabet;
    }

    public int size() {
        return states.size();
    }

    public int getInitialState() {
        return 0;
    }

    public List<SubsetState> getStates() {
        return states;
    }

    public SubsetState getState(int id) {
        return states.get(id);
    }

    public boolean isAccepting(int id) {
        return states.get(id).isAccepting();
    }

    public boolean hasDeadState() {
        return deadState != NO_DEAD_STATE;
    }

    public int getDeadState() {
        return deadState;
    }

    public int getSuccessor(int state, int symbolIndex) {
        return transitions[state][symbolIndex];
    }

    public int getSuccessor(int state, String symbol) {
        final int idx = alphabet.getSymbolIndex(symbol);
        if (idx < 0) {
            throw new IllegalArgumentException("Symbol " + symbol + " is not in the alphabet");
        }
        return transitions[state][idx];
    }

    /**
     * Total number of transitions, one per (state, symbol).
     */
    public int getTransitionCount() {
        return states.size() * alphabet.size();
    }

    public int getStateReachedBy(Iterable<String> word) {
        int state = getInitialState();
        for (String symbol : word) {
            state = getSuccessor(state, symbol);
        }
        return state;
    }

    public boolean accepts(Iterable<String> word) {
        return isAccepting(getStateReachedBy(word));
    }

    /**
     * Copy into an AutomataLib automaton; state ids are preserved.
     */
    public CompactDFA<String> toCompactDFA() {
        final CompactDFA<String> out = new CompactDFA<>(alphabet);
        for (SubsetState s : states) {
            if (s.getId() == getInitialState()) {
                out.addInitialState(s.isAccepting());
            } else {
                out.addState(s.isAccepting());
            }
        }
        for (int q = 0; q < transitions.length; q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                out.setTransition(q, a, transitions[q][a]);
            }
        }
        return out;
    }
}
