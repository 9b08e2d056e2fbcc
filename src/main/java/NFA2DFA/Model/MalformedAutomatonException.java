package NFA2DFA.Model;

/**
 * The description parsed, but does not describe a valid NFA (dangling references, count
 * disagreements, duplicate names).
 */
public class MalformedAutomatonException extends ConversionException {
    public MalformedAutomatonException(String message) {
        super(message);
    }
}
