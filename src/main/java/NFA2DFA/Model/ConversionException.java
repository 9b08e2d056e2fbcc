package NFA2DFA.Model;

/**
 * Base of every failure that aborts a conversion attempt. None of them are retried.
 */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
