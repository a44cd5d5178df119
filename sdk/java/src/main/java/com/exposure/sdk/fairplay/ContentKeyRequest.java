package com.exposure.sdk.fairplay;

import java.net.URI;

/**
 * Platform side of a content key request, as raised by the player's resource loader.
 *
 * <p>Implementations bridge to the real DRM subsystem; the handshake only talks to the platform
 * through this interface.
 */
public interface ContentKeyRequest {

    /**
     * @return the requested resource, {@code skd://<asset>} for Fairplay keys, or {@code null}
     */
    URI url();

    /**
     * Creates the server playback context for the given application certificate and content id.
     */
    byte[] serverPlaybackContext(byte[] applicationCertificate, byte[] contentIdentifier)
            throws PlatformDrmException;

    /**
     * @return {@code false} if the platform no longer expects data for this request
     */
    boolean hasDataRequest();

    void respond(byte[] contentKeyContext);

    void finishLoading();

    void finishLoading(FairplayException error);

    /**
     * @return {@code true} once the platform has torn the request down
     */
    boolean isCancelled();
}
