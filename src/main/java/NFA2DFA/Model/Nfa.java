package NFA2DFA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Immutable, validated NFA. States are renamed to {@code q0..q(n-1)} in declaration order;
 * the original names are kept for presentation.
 */
public final class Nfa {
    public static final String CANONICAL_PREFIX = "q";

    private final List<String> originalNames;
    private final Alphabet<String> alphabet;
    private final int startState;
    private final BitSet acceptingStates;
    private final int transitionCount;
    private final CompactNFA<String> automaton;

    private Nfa(List<String> originalNames, Alphabet<String> alphabet, int startState,
                BitSet acceptingStates, int transitionCount, CompactNFA<String> automaton) {
        this.originalNames = originalNames;
        this.alphabet = alphabet;
        this.startState = startState;
        this.acceptingStates = acceptingStates;
        this.transitionCount = transitionCount;
        this.automaton = automaton;
    }

    /**
     * Validate raw fields and build the NFA.
     * @param definition - parsed fields
     * @return validated NFA
     * @throws MalformedAutomatonException if counts disagree with lists, names are duplicated,
     *  or any reference points outside the declared states/alphabet.
     */
    public static Nfa of(NfaDefinition definition) throws MalformedAutomatonException {
        checkCount("states", definition.stateCount(), definition.states().size());
        checkCount("symbols", definition.symbolCount(), definition.symbols().size());
        checkCount("accepting states", definition.acceptingCount(), definition.acceptingStates().size());
        checkCount("transitions", definition.transitionCount(), definition.transitions().size());

        final Map<String, Integer> stateIndex = new HashMap<>();
        for (String name : definition.states()) {
            if (stateIndex.putIfAbsent(name, stateIndex.size()) != null) {
                throw new MalformedAutomatonException("Duplicate state: " + name);
            }
        }
        final Set<String> seenSymbols = new HashSet<>();
        for (String symbol : definition.symbols()) {
            if (!seenSymbols.add(symbol)) {
                throw new MalformedAutomatonException("Duplicate symbol: " + symbol);
            }
        }

        final int start = lookup(stateIndex, definition.startState(), "Start state");
        final BitSet accepting = new BitSet();
        for (String name : definition.acceptingStates()) {
            accepting.set(lookup(stateIndex, name, "Accepting state"));
        }

        final Alphabet<String> alphabet = Alphabets.fromList(new ArrayList<>(definition.symbols()));
        final int n = definition.states().size();
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, n);
        for (int i = 0; i < n; i++) {
            nfa.addState(accepting.get(i));
        }
        nfa.setInitial(start, true);

        for (NfaDefinition.Transition t : definition.transitions()) {
            final int from = lookup(stateIndex, t.fromState(), "Transition '" + t + "': source state");
            final int to = lookup(stateIndex, t.toState(), "Transition '" + t + "': target state");
            if (!seenSymbols.contains(t.symbol())) {
                throw new MalformedAutomatonException(
                    "Transition '" + t + "': symbol " + t.symbol() + " is not in the alphabet");
            }
            nfa.addTransition(from, t.symbol(), to); // set semantics, duplicates are no-ops
        }

        return new Nfa(List.copyOf(definition.states()), alphabet, start, accepting,
            definition.transitions().size(), nfa);
    }

    private static void checkCount(String what, int declared, int actual) throws MalformedAutomatonException {
        if (declared != actual) {
            throw new MalformedAutomatonException(
                "Declared " + declared + " " + what + " but " + actual + " were supplied");
        }
    }

    private static int lookup(Map<String, Integer> stateIndex, String name, String role)
        throws MalformedAutomatonException {
        final Integer idx = stateIndex.get(name);
        if (idx == null) {
            throw new MalformedAutomatonException(role + " " + name + " is not a declared state");
        }
        return idx;
    }

    public int size() {
        return originalNames.size();
    }

    public Alphabet<String> getInputAlphabet() {
        return alphabet;
    }

    public int getStartState() {
        return startState;
    }

    public boolean isAccepting(int state) {
        return acceptingStates.get(state);
    }

    public BitSet getAcceptingStates() {
        return (BitSet) acceptingStates.clone();
    }

    /**
     * Number of transition lines given at construction, duplicates included.
     */
    public int getDeclaredTransitionCount() {
        return transitionCount;
    }

    public String getCanonicalName(int state) {
        return CANONICAL_PREFIX + state;
    }

    public String getOriginalName(int state) {
        return originalNames.get(state);
    }

    public boolean isRenamed() {
        for (int i = 0; i < originalNames.size(); i++) {
            if (!originalNames.get(i).equals(getCanonicalName(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return successors in ascending order
     */
    public SortedSet<Integer> getSuccessors(int state, String symbol) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(automaton.getTransitions(state, symbol)));
    }

    public boolean accepts(Iterable<String> word) {
        return automaton.accepts(word);
    }

    /**
     * View of the NFA whose states are sets of NFA states. The subset construction walks this.
     */
    public AcceptorPowersetViewTS<BitSet, String, Integer> powersetView() {
        return automaton.powersetView();
    }

    /**
     * @return mutable copy of the underlying automaton, for callers that feed it to AutomataLib.
     */
    public CompactNFA<String> toCompactNFA() {
        final CompactNFA<String> copy = new CompactNFA<>(alphabet, size());
        for (int q = 0; q < size(); q++) {
            copy.addState(isAccepting(q));
        }
        copy.setInitial(startState, true);
        for (int q = 0; q < size(); q++) {
            for (String symbol : alphabet) {
                for (int succ : automaton.getTransitions(q, symbol)) {
                    copy.addTransition(q, symbol, succ);
                }
            }
        }
        return copy;
    }
}
