package com.exposure.sdk.fairplay;

import com.exposure.sdk.client.ExposureClientConfig;
import com.exposure.sdk.entitlement.PlaybackEntitlement;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Entry point for the player's resource loader. Claims Fairplay content key requests for one
 * entitlement and runs a {@link LicenseHandshake} for each of them.
 *
 * <p>Every claimed request gets its own single threaded executor, so the steps of one handshake never
 * interleave while handshakes for different requests run in parallel.
 */
public final class FairplayRequester {
    private static final Logger LOGGER = Logger.getLogger(FairplayRequester.class.getName());
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final PlaybackEntitlement entitlement;
    private final LicenseTransport transport;
    private final String scheme;
    private final String playTokenHeader;

    public FairplayRequester(PlaybackEntitlement entitlement, LicenseTransport transport) {
        this(entitlement, transport, ExposureClientConfig.DEFAULT_FAIRPLAY_SCHEME,
                ExposureClientConfig.DEFAULT_PLAY_TOKEN_HEADER);
    }

    public FairplayRequester(PlaybackEntitlement entitlement,
                             LicenseTransport transport,
                             String scheme,
                             String playTokenHeader) {
        this.entitlement = Objects.requireNonNull(entitlement, "entitlement");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.playTokenHeader = Objects.requireNonNull(playTokenHeader, "playTokenHeader");
    }

    public PlaybackEntitlement getEntitlement() {
        return entitlement;
    }

    /**
     * Returning {@code true} only means the request was claimed; the handshake may still fail and
     * report through {@link ContentKeyRequest#finishLoading(FairplayException)}.
     *
     * @return {@code false} for requests whose url scheme is not the Fairplay key scheme
     */
    public boolean shouldWaitForLoading(ContentKeyRequest request) {
        return claim(request) != null;
    }

    public boolean shouldWaitForRenewal(ContentKeyRequest request) {
        return claim(request) != null;
    }

    /**
     * Claims and starts a handshake for {@code request}.
     *
     * @return the running handshake, or {@code null} if the request was not claimed
     */
    public LicenseHandshake claim(ContentKeyRequest request) {
        if (!canHandle(request)) {
            return null;
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(daemonThreads());
        LicenseHandshake handshake = new LicenseHandshake(entitlement, request, transport, playTokenHeader, executor);
        handshake.result().whenComplete((ckc, error) -> executor.shutdown());
        handshake.start();
        return handshake;
    }

    boolean canHandle(ContentKeyRequest request) {
        URI url = request.url();
        if (url == null || !scheme.equals(url.getScheme())) {
            LOGGER.finer(() -> "Ignoring resource request " + url);
            return false;
        }
        return true;
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "exposure-fairplay-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
