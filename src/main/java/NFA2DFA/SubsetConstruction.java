package NFA2DFA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import NFA2DFA.Model.ConstructionStep;
import NFA2DFA.Model.ConversionResult;
import NFA2DFA.Model.Nfa;
import NFA2DFA.Model.SubsetDfa;
import NFA2DFA.Model.SubsetState;
import NFA2DFA.Registry.HashRegistry;
import NFA2DFA.Registry.Registry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.ts.AcceptorPowersetViewTS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction over the reachable part of the powerset, with a FIFO worklist so that
 * state numbering and the log follow discovery order.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

    private final Nfa nfa;
    private final Registry registry;
    private final AcceptorPowersetViewTS<BitSet, String, Integer> powerset;
    private final Alphabet<String> alphabet;

    private final List<SubsetState> states = new ArrayList<>();
    private final List<int[]> rows = new ArrayList<>();
    private final List<ConstructionStep> log = new ArrayList<>();
    private int deadState = SubsetDfa.NO_DEAD_STATE;

    private SubsetConstruction(Nfa nfa, Registry registry) {
        this.nfa = nfa;
        this.registry = registry;
        this.powerset = nfa.powersetView();
        this.alphabet = nfa.getInputAlphabet();
    }

    public static ConversionResult determinize(Nfa nfa) {
        return determinize(nfa, new HashRegistry());
    }

    /**
     * Main loop.
     * @param nfa - validated NFA
     * @param registry - empty registry used to recognise subsets already discovered
     * @return - DFA over the reachable subsets, plus the construction log
     */
    public static ConversionResult determinize(Nfa nfa, Registry registry) {
        if (registry.size() != 0) {
            throw new IllegalArgumentException("Registry must be empty, has " + registry.size() + " entries");
        }
        return new SubsetConstruction(nfa, registry).run();
    }

    private ConversionResult run() {
        final Deque<DeterminizeRecord> worklist = new ArrayDeque<>();

        final BitSet init = new BitSet();
        init.set(nfa.getStartState());
        final int initOut = addState(init);
        registry.put(init, initOut);
        worklist.addLast(new DeterminizeRecord(init, initOut));

        while (!worklist.isEmpty()) {
            final DeterminizeRecord curr = worklist.pollFirst();
            final int[] row = rows.get(curr.outputState());

            for (int a = 0; a < alphabet.size(); a++) {
                final String sym = alphabet.getSymbol(a);
                final BitSet succ = powerset.getSuccessor(curr.inputState(), sym);

                int outSucc;
                boolean discovered = false;
                if (succ == null || succ.isEmpty()) {
                    if (deadState == SubsetDfa.NO_DEAD_STATE) {
                        deadState = addState(new BitSet());
                        Arrays.fill(rows.get(deadState), deadState); // absorbing
                        discovered = true;
                    }
                    outSucc = deadState;
                } else {
                    outSucc = registry.get(succ);
                    if (outSucc == Registry.MISSING_ELEMENT) {
                        // add new state to DFA and to worklist
                        final BitSet key = (BitSet) succ.clone();
                        outSucc = addState(key);
                        registry.put(key, outSucc);
                        worklist.addLast(new DeterminizeRecord(key, outSucc));
                        discovered = true;
                    }
                }
                row[a] = outSucc;
                log.add(new ConstructionStep(curr.outputState(), sym, outSucc, discovered));
            }
        }

        if (deadState != SubsetDfa.NO_DEAD_STATE) {
            for (int a = 0; a < alphabet.size(); a++) {
                log.add(new ConstructionStep(deadState, alphabet.getSymbol(a), deadState, false));
            }
        }

        LOG.debug("Subset construction: {} NFA states -> {} DFA states{}", nfa.size(), states.size(),
            deadState == SubsetDfa.NO_DEAD_STATE ? "" : " (including dead state " + SubsetState.ID_PREFIX + deadState + ")");

        final SubsetDfa dfa = new SubsetDfa(alphabet, states, rows.toArray(new int[0][]), deadState);
        return new ConversionResult(nfa, dfa, log);
    }

    private int addState(BitSet subset) {
        final int id = states.size();
        final SubsetState state = new SubsetState(id, subset, powerset.isAccepting(subset));
        states.add(state);
        rows.add(new int[alphabet.size()]);
        LOG.debug("Discovered {}{}", state, state.isAccepting() ? " (accepting)" : "");
        return id;
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
