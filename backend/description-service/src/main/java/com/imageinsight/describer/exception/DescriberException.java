package com.imageinsight.describer.exception;

/**
 * Base class for description service errors.
 */
public class DescriberException extends RuntimeException {

    private final String errorCode;

    public DescriberException(String message) {
        super(message);
        this.errorCode = "DESCRIBER_ERROR";
    }

    public DescriberException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "DESCRIBER_ERROR";
    }

    public DescriberException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DescriberException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
