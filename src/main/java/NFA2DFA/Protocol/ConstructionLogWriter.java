package NFA2DFA.Protocol;

import java.util.StringJoiner;

import NFA2DFA.Model.ConstructionStep;
import NFA2DFA.Model.ConversionResult;
import NFA2DFA.Model.SubsetDfa;
import NFA2DFA.Model.SubsetState;

/**
 * Renders the chronological construction log for human review.
 */
public final class ConstructionLogWriter {
    static final String INDENT = "    ";

    private ConstructionLogWriter() {
    }

    public static String write(ConversionResult result) {
        final SubsetDfa dfa = result.dfa();
        final StringBuilder sb = new StringBuilder();
        sb.append("Subset construction log:\n");
        sb.append("Start state ").append(dfa.getState(dfa.getInitialState())).append('\n');

        int current = -1;
        for (ConstructionStep step : result.log()) {
            if (step.source() != current) {
                current = step.source();
                final SubsetState source = dfa.getState(current);
                sb.append(source.isDead() ? "Dead state " : "Processing ").append(source).append(":\n");
            }
            sb.append(INDENT).append("On symbol '").append(step.symbol()).append("' -> ")
              .append(dfa.getState(step.target()))
              .append(step.discovered() ? " (new)" : " (known)")
              .append('\n');
        }

        sb.append("Accepting states: ").append(acceptingNames(dfa)).append('\n');
        return sb.toString();
    }

    static String acceptingNames(SubsetDfa dfa) {
        final StringJoiner joiner = new StringJoiner(" ");
        joiner.setEmptyValue("none");
        for (SubsetState s : dfa.getStates()) {
            if (s.isAccepting()) {
                joiner.add(s.getName());
            }
        }
        return joiner.toString();
    }
}
