package NFA2DFA.Model;

import java.util.List;

/**
 * Output of one conversion: the input NFA, the frozen DFA and the chronological log.
 */
public record ConversionResult(Nfa nfa, SubsetDfa dfa, List<ConstructionStep> log) {
    public ConversionResult {
        log = List.copyOf(log);
    }
}
