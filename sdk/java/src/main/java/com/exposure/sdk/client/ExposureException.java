package com.exposure.sdk.client;

/**
 * Failure raised by the REST layer and by response decoding.
 */
public final class ExposureException extends RuntimeException {
    public enum Kind {
        /** Transport or connectivity failure, or an unacceptable status without a structured body. */
        NETWORK_FAILURE,
        /** Server reported error, carrying the server's code and message. */
        SERVER_ERROR,
        /** Response body could not be decoded. */
        PARSE_FAILURE
    }

    private final Kind kind;
    private final Integer code;

    public ExposureException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public ExposureException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public ExposureException(Kind kind, Integer code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static ExposureException serverError(int code, String message) {
        return new ExposureException(Kind.SERVER_ERROR, code, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Server supplied code for {@link Kind#SERVER_ERROR}, the HTTP status for status related
     * network failures, {@code null} otherwise.
     */
    public Integer getCode() {
        return code;
    }
}
