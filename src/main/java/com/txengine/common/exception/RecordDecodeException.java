package com.txengine.common.exception;

/**
 * Thrown when the transaction source cannot turn its input into a record.
 */
public class RecordDecodeException extends TxEngineException {

    private final long lineNumber;

    public RecordDecodeException(String message, long lineNumber) {
        super(formatMessage(message, lineNumber));
        this.lineNumber = lineNumber;
    }

    public RecordDecodeException(String message, long lineNumber, Throwable cause) {
        super(formatMessage(message, lineNumber), cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Line of the input the failure refers to, or -1 when it is not tied to a line.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    private static String formatMessage(String message, long lineNumber) {
        return lineNumber < 0 ? message : String.format("Line %d: %s", lineNumber, message);
    }
}
