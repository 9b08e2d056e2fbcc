package NFA2DFA.Protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import NFA2DFA.Model.Nfa;

/**
 * Writes an NFA in the input description format, using canonical state names.
 * {@link ProtocolParser} reads the result back into an equivalent NFA.
 */
public final class ProtocolWriter {
    private ProtocolWriter() {
    }

    public static String write(Nfa nfa) {
        final List<String> states = new ArrayList<>(nfa.size());
        final List<String> accepting = new ArrayList<>();
        final List<String> transitions = new ArrayList<>();
        for (int q = 0; q < nfa.size(); q++) {
            states.add(nfa.getCanonicalName(q));
            if (nfa.isAccepting(q)) {
                accepting.add(nfa.getCanonicalName(q));
            }
            for (String symbol : nfa.getInputAlphabet()) {
                for (int succ : nfa.getSuccessors(q, symbol)) {
                    transitions.add(nfa.getCanonicalName(q) + " " + symbol + " " + nfa.getCanonicalName(succ));
                }
            }
        }

        final StringBuilder sb = new StringBuilder();
        appendLine(sb, ProtocolField.STATE_COUNT, String.valueOf(states.size()));
        appendLine(sb, ProtocolField.STATES, join(states));
        appendLine(sb, ProtocolField.SYMBOL_COUNT, String.valueOf(nfa.getInputAlphabet().size()));
        appendLine(sb, ProtocolField.SYMBOLS, join(nfa.getInputAlphabet()));
        appendLine(sb, ProtocolField.START_STATE, nfa.getCanonicalName(nfa.getStartState()));
        appendLine(sb, ProtocolField.ACCEPTING_COUNT, String.valueOf(accepting.size()));
        appendLine(sb, ProtocolField.ACCEPTING_STATES, join(accepting));
        appendLine(sb, ProtocolField.TRANSITION_COUNT, String.valueOf(transitions.size()));
        for (String t : transitions) {
            appendLine(sb, ProtocolField.TRANSITION, t);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, ProtocolField field, String value) {
        sb.append(field.line(value)).append('\n');
    }

    private static String join(Iterable<String> names) {
        final StringJoiner joiner = new StringJoiner(" ");
        for (String name : names) {
            joiner.add(name);
        }
        return joiner.toString();
    }
}
