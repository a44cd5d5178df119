package com.exposure.sdk.fairplay;

/**
 * Error reported by the platform DRM subsystem, for example an invalid certificate (-42679) or
 * an expired lease (-42656). Passed through to callers untouched.
 */
public class PlatformDrmException extends Exception {
    private final int errorCode;

    public PlatformDrmException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PlatformDrmException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
