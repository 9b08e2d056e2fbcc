package NFA2DFA;

/**
 * Knobs of a {@link Converter}.
 *
 * @param includeDeadState draw the dead state and the edges into it
 * @param maxNfaStates     largest NFA accepted; work grows exponentially with it
 */
public record ConverterConfig(boolean includeDeadState, int maxNfaStates) {
    public static final int DEFAULT_MAX_NFA_STATES = 24;

    public ConverterConfig {
        if (maxNfaStates < 1) {
            throw new IllegalArgumentException("maxNfaStates must be positive, got " + maxNfaStates);
        }
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig(false, DEFAULT_MAX_NFA_STATES);
    }

    public ConverterConfig withIncludeDeadState(boolean include) {
        return new ConverterConfig(include, maxNfaStates);
    }

    public ConverterConfig withMaxNfaStates(int max) {
        return new ConverterConfig(includeDeadState, max);
    }
}
