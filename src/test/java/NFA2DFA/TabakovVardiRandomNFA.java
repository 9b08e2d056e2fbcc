package NFA2DFA;

import NFA2DFA.Model.MalformedAutomatonException;
import NFA2DFA.Model.Nfa;
import NFA2DFA.Model.NfaDefinition;
import NFA2DFA.Model.NfaDefinition.Transition;
import net.automatalib.common.util.random.RandomUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class TabakovVardiRandomNFA {
    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @param symbols
     *      alphabet
     * @return
     *      raw fields of a random NFA, not necessarily connected
     */
    public static NfaDefinition generateNFA(Random r, int size, float td, float ad, List<String> symbols) {
        return generateNFA(r, size, Math.round(td * size), Math.max(1, Math.round(ad * size)), symbols);
    }

    /**
     * Generate random NFA, with fixed number of accept states and edges (per letter).
     * State {@code s0} is the start state and always accepting.
     */
    public static NfaDefinition generateNFA(Random r, int size, int edgeNum, int acceptNum, List<String> symbols) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        final List<String> states = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            states.add("s" + i);
        }

        final List<String> accepting = new ArrayList<>(acceptNum);
        accepting.add(states.get(0));
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            accepting.add(states.get(f));
        }

        final List<Transition> transitions = new ArrayList<>();
        for (String a : symbols) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                transitions.add(new Transition(states.get(edgeIndex / size), a, states.get(edgeIndex % size)));
            }
        }

        return NfaDefinition.of(states, symbols, states.get(0), accepting, transitions);
    }

    public static Nfa getRandomAutomaton(int randomSeed, int size) throws MalformedAutomatonException {
        final float td = 1.25f;
        final float ad = 0.5f;
        final Random random = new Random(randomSeed);
        return Nfa.of(generateNFA(random, size, td, ad, List.of("0", "1")));
    }
}
