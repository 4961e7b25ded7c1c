package org.tapeshift.converter.api;

/**
 * An exception that is thrown when a conversion cannot be completed.
 * <p>
 * Every failure is fatal: the first one encountered aborts the whole conversion and
 * no output is written. The {@link ConversionErrorCode} identifies the kind of failure,
 * the offending text is kept separately so callers do not have to parse the message.
 */
public class ConversionException extends Exception {

    private final ConversionErrorCode errorCode;
    private final String offendingText;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new conversion exception.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param offendingText The input text that caused the failure, may be null.
     */
    public ConversionException(ConversionErrorCode errorCode, String message, String offendingText) {
        this(errorCode, message, offendingText, null, null);
    }

    /**
     * Constructs a new conversion exception caused by another exception, typically an I/O failure.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ConversionException(ConversionErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    /**
     * Constructs a new conversion exception that points at a specific input line.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param offendingText The input text that caused the failure, may be null.
     * @param sourceInfo The location of the failing line.
     */
    public ConversionException(ConversionErrorCode errorCode, String message, String offendingText, SourceInfo sourceInfo) {
        this(errorCode, message, offendingText, sourceInfo, null);
    }

    private ConversionException(ConversionErrorCode errorCode, String message, String offendingText,
                                SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo != null ? String.format("%s at %s", message, sourceInfo) : message, cause);
        this.errorCode = errorCode;
        this.offendingText = offendingText;
        this.sourceInfo = sourceInfo;
    }

    public ConversionErrorCode getErrorCode() {
        return errorCode;
    }

    public String getOffendingText() {
        return offendingText;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
