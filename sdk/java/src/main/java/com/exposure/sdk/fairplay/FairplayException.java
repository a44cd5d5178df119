package com.exposure.sdk.fairplay;

/**
 * Terminal failure of a Fairplay license handshake.
 */
public final class FairplayException extends RuntimeException {
    public enum Reason {
        NETWORK_FAILURE,
        SERVER_ERROR,
        PARSE_FAILURE,
        INVALID_CONTENT_IDENTIFIER,
        MISSING_CERTIFICATE_URL,
        MISSING_LICENSE_URL,
        /** The platform failed to create the server playback context; the cause is the platform error. */
        SERVER_PLAYBACK_CONTEXT,
        MISSING_DATA_REQUEST,
        /** A platform or transport callback threw instead of reporting through its contract. */
        UNEXPECTED
    }

    /** Handshake step that failed. */
    public enum Step {
        CERTIFICATE,
        SERVER_PLAYBACK_CONTEXT,
        CONTENT_KEY_CONTEXT,
        COMPLETION
    }

    private final Reason reason;
    private final Step step;
    private final Integer serverCode;
    private final String serverMessage;

    private FairplayException(Reason reason, Step step, Integer serverCode, String serverMessage,
                              String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.step = step;
        this.serverCode = serverCode;
        this.serverMessage = serverMessage;
    }

    public static FairplayException of(Reason reason, Step step, String message) {
        return new FairplayException(reason, step, null, null, message, null);
    }

    public static FairplayException networkFailure(Step step, String message, Throwable cause) {
        return new FairplayException(Reason.NETWORK_FAILURE, step, null, null, message, cause);
    }

    public static FairplayException serverError(Step step, int code, String message) {
        return new FairplayException(Reason.SERVER_ERROR, step, code, message,
                "Server error " + code + ": " + message, null);
    }

    public static FairplayException unexpected(Step step, Throwable cause) {
        return new FairplayException(Reason.UNEXPECTED, step, null, null,
                "Unexpected failure during " + step + ": " + cause, cause);
    }

    public static FairplayException serverPlaybackContext(PlatformDrmException cause) {
        return new FairplayException(Reason.SERVER_PLAYBACK_CONTEXT, Step.SERVER_PLAYBACK_CONTEXT, null, null,
                "Failed to create server playback context: " + cause.getMessage(), cause);
    }

    public Reason getReason() {
        return reason;
    }

    public Step getStep() {
        return step;
    }

    public Integer getServerCode() {
        return serverCode;
    }

    public String getServerMessage() {
        return serverMessage;
    }

    public boolean isMissingConfiguration() {
        return reason == Reason.MISSING_CERTIFICATE_URL || reason == Reason.MISSING_LICENSE_URL;
    }
}
