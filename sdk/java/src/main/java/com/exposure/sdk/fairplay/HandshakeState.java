package com.exposure.sdk.fairplay;

public enum HandshakeState {
    IDLE,
    CERTIFICATE_REQUESTED,
    CERTIFICATE_RECEIVED,
    KEY_REQUEST_BUILT,
    KEY_CONTEXT_REQUESTED,
    COMPLETED,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED;
    }
}
