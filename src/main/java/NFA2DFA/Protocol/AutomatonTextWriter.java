package NFA2DFA.Protocol;

import java.util.StringJoiner;
import java.util.SortedSet;

import NFA2DFA.Model.Nfa;
import NFA2DFA.Model.SubsetDfa;
import NFA2DFA.Model.SubsetState;

/**
 * Console renderings of the input NFA and the converted DFA.
 */
public final class AutomatonTextWriter {
    private static final String RULE = "********************************************";

    private AutomatonTextWriter() {
    }

    public static String describe(Nfa nfa) {
        final StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');

        final StringJoiner states = new StringJoiner(" ");
        final StringJoiner accepting = new StringJoiner(" ");
        accepting.setEmptyValue("none");
        for (int q = 0; q < nfa.size(); q++) {
            states.add(nfa.getCanonicalName(q));
            if (nfa.isAccepting(q)) {
                accepting.add(nfa.getCanonicalName(q));
            }
        }
        sb.append("States: ").append(states).append('\n');
        if (nfa.isRenamed()) {
            final StringJoiner renamed = new StringJoiner(" ");
            for (int q = 0; q < nfa.size(); q++) {
                renamed.add(nfa.getOriginalName(q) + "=" + nfa.getCanonicalName(q));
            }
            sb.append("Renamed: ").append(renamed).append('\n');
        }
        sb.append("Symbols: ").append(String.join(" ", nfa.getInputAlphabet())).append('\n');
        sb.append("Start state: ").append(nfa.getCanonicalName(nfa.getStartState())).append('\n');

        sb.append("Transitions:\n");
        for (int q = 0; q < nfa.size(); q++) {
            for (String symbol : nfa.getInputAlphabet()) {
                final SortedSet<Integer> succs = nfa.getSuccessors(q, symbol);
                if (succs.isEmpty()) {
                    continue;
                }
                final StringJoiner targets = new StringJoiner(" ");
                for (int s : succs) {
                    targets.add(nfa.getCanonicalName(s));
                }
                sb.append("From state ").append(nfa.getCanonicalName(q)).append(" -> ").append(symbol)
                  .append(" -> ").append(targets).append('\n');
            }
        }

        sb.append("Accepting states: ").append(accepting).append('\n');
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    public static String describe(SubsetDfa dfa) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Converted DFA:\n");
        for (SubsetState s : dfa.getStates()) {
            sb.append("State ").append(s.getName()).append(' ').append(s.getDisplayName()).append(":\n");
            for (int a = 0; a < dfa.getInputAlphabet().size(); a++) {
                final SubsetState target = dfa.getState(dfa.getSuccessor(s.getId(), a));
                sb.append(ConstructionLogWriter.INDENT).append("On symbol '").append(dfa.getInputAlphabet().getSymbol(a))
                  .append("' -> ").append(target.getName()).append(' ').append(target.getDisplayName()).append('\n');
            }
        }
        sb.append("Start state: ").append(dfa.getState(dfa.getInitialState()).getName()).append('\n');
        sb.append("Accepting states: ").append(ConstructionLogWriter.acceptingNames(dfa)).append('\n');
        return sb.toString();
    }
}
