package com.exposure.sdk.fairplay;

import java.util.Objects;

/**
 * Outcome of parsing a license server XML envelope.
 */
public final class EnvelopeResult {
    public enum Kind {
        PAYLOAD,
        SERVER_ERROR,
        UNRECOGNIZED
    }

    private final Kind kind;
    private final byte[] payload;
    private final int code;
    private final String message;

    private EnvelopeResult(Kind kind, byte[] payload, int code, String message) {
        this.kind = kind;
        this.payload = payload;
        this.code = code;
        this.message = message;
    }

    static EnvelopeResult payload(byte[] payload) {
        return new EnvelopeResult(Kind.PAYLOAD, Objects.requireNonNull(payload, "payload"), 0, null);
    }

    static EnvelopeResult serverError(int code, String message) {
        return new EnvelopeResult(Kind.SERVER_ERROR, null, code, message);
    }

    static EnvelopeResult unrecognized(String reason) {
        return new EnvelopeResult(Kind.UNRECOGNIZED, null, 0, reason);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Decoded payload; only set for {@link Kind#PAYLOAD}.
     */
    public byte[] getPayload() {
        return payload == null ? null : payload.clone();
    }

    /**
     * Server code; only meaningful for {@link Kind#SERVER_ERROR}.
     */
    public int getCode() {
        return code;
    }

    /**
     * Server message for {@link Kind#SERVER_ERROR}, a diagnostic for {@link Kind#UNRECOGNIZED}.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        switch (kind) {
            case PAYLOAD:
                return "EnvelopeResult[PAYLOAD, " + payload.length + " bytes]";
            case SERVER_ERROR:
                return "EnvelopeResult[SERVER_ERROR, " + code + ": " + message + "]";
            default:
                return "EnvelopeResult[UNRECOGNIZED, " + message + "]";
        }
    }
}
