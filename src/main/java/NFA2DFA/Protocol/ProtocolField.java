package NFA2DFA.Protocol;

/**
 * Prompt labels of the line-oriented automaton description, in the order they must appear.
 */
public enum ProtocolField {
    STATE_COUNT("Enter number of states:"),
    STATES("Enter states:"),
    SYMBOL_COUNT("Enter number of symbols:"),
    SYMBOLS("Enter symbols (separate by space):"),
    START_STATE("Enter start state:"),
    ACCEPTING_COUNT("Enter number of accepting states:"),
    ACCEPTING_STATES("Enter accepting states:"),
    TRANSITION_COUNT("Enter number of transitions:"),
    TRANSITION("Enter transition (fromState symbol toState):");

    private final String label;

    ProtocolField(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return {@code label + " " + value}, or the bare label when value is empty
     */
    public String line(String value) {
        return value.isEmpty() ? label : label + " " + value;
    }
}
