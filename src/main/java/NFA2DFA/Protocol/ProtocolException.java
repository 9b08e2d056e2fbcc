package NFA2DFA.Protocol;

import NFA2DFA.Model.ConversionException;

/**
 * The text does not follow the line/count structure of the automaton description.
 */
public class ProtocolException extends ConversionException {
    public static final int UNKNOWN_LINE = -1;

    private final int line;

    public ProtocolException(String message) {
        this(UNKNOWN_LINE, message);
    }

    public ProtocolException(int line, String message) {
        super(line == UNKNOWN_LINE ? message : "line " + line + ": " + message);
        this.line = line;
    }

    /**
     * @return 1-based line number of the offending line, or {@link #UNKNOWN_LINE}
     */
    public int getLine() {
        return line;
    }
}
