package NFA2DFA.Export;

import NFA2DFA.Model.ConversionException;

public class ExportException extends ConversionException {
    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
