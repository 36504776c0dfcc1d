package com.imageinsight.describer.exception;

import com.imageinsight.describer.entity.ErrorKind;

/**
 * Failure talking to the vision API: either the call itself failed or the
 * service rejected it with a non-2xx status.
 */
public class VisionApiException extends DescriberException {

    private final int statusCode;
    private final ErrorKind kind;

    public VisionApiException(ErrorKind kind, String message, int statusCode) {
        super("VISION_API_ERROR", message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public VisionApiException(ErrorKind kind, String message, Throwable cause) {
        super("VISION_API_ERROR", message, cause);
        this.kind = kind;
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Submit call answered with a non-2xx status
     */
    public static VisionApiException rejected(String message, int statusCode) {
        return new VisionApiException(ErrorKind.REMOTE_REJECTION, message, statusCode);
    }

    /**
     * Poll call answered with a non-2xx status other than 202
     */
    public static VisionApiException pollingFailed(int statusCode, String bodySnippet) {
        return new VisionApiException(ErrorKind.TRANSPORT,
                "Polling error (" + statusCode + "): " + bodySnippet, statusCode);
    }

    /**
     * Connection, timeout or decoding failure before any usable response arrived
     */
    public static VisionApiException transport(Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new VisionApiException(ErrorKind.TRANSPORT, detail, cause);
    }
}
