package NFA2DFA;

import NFA2DFA.Model.ConversionException;

/**
 * The constructed DFA does not accept the same language as AutomataLib's determinization of the NFA.
 */
public class VerificationException extends ConversionException {
    public VerificationException(String message) {
        super(message);
    }
}
