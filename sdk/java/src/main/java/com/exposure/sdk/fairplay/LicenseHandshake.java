package com.exposure.sdk.fairplay;

import com.exposure.sdk.entitlement.PlaybackEntitlement;
import com.exposure.sdk.fairplay.FairplayException.Reason;
import com.exposure.sdk.fairplay.FairplayException.Step;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fairplay license acquisition for a single content key request.
 *
 * <p>The exchange runs in three steps, strictly in sequence on the supplied serial executor:
 * <ol>
 *     <li>fetch and parse the application certificate from {@code certificateUrl}</li>
 *     <li>have the platform create a server playback context (SPC) for the asset</li>
 *     <li>exchange the SPC for a content key context (CKC) at {@code licenseAcquisitionUrl}</li>
 * </ol>
 * The CKC is then handed to the platform. Any failure is terminal and is reported to the platform
 * exactly once through {@link ContentKeyRequest#finishLoading(FairplayException)}. Nothing is
 * retried.
 *
 * <p>If the platform cancels the request, in-flight HTTP calls still complete but their results are
 * dropped and the platform is not called back.
 */
public final class LicenseHandshake {
    private static final Logger LOGGER = Logger.getLogger(LicenseHandshake.class.getName());
    private static final String CONTENT_TYPE = "application/octet-stream";

    private final PlaybackEntitlement entitlement;
    private final ContentKeyRequest request;
    private final LicenseTransport transport;
    private final String playTokenHeader;
    private final Executor executor;
    private final CompletableFuture<byte[]> result = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile HandshakeState state = HandshakeState.IDLE;

    public LicenseHandshake(PlaybackEntitlement entitlement,
                            ContentKeyRequest request,
                            LicenseTransport transport,
                            String playTokenHeader,
                            Executor executor) {
        this.entitlement = Objects.requireNonNull(entitlement, "entitlement");
        this.request = Objects.requireNonNull(request, "request");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.playTokenHeader = Objects.requireNonNull(playTokenHeader, "playTokenHeader");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Starts the exchange on the handshake's executor.
     *
     * @return completes with the CKC bytes handed to the platform, exceptionally with a
     * {@link FairplayException}, or is cancelled when the platform tore the request down
     */
    public CompletableFuture<byte[]> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Handshake already started");
        }
        executor.execute(this::run);
        return result;
    }

    /**
     * Drops the outcome of any in-flight step. The platform will not be called back.
     */
    public void cancel() {
        cancelled = true;
    }

    public HandshakeState getState() {
        return state;
    }

    public CompletableFuture<byte[]> result() {
        return result;
    }

    private void run() {
        byte[] contentIdentifier;
        try {
            contentIdentifier = contentIdentifier();
        } catch (FairplayException e) {
            finish(null, e);
            return;
        }
        fetchCertificate()
                .thenApplyAsync(certificate -> buildKeyRequest(certificate, contentIdentifier), executor)
                .thenComposeAsync(this::fetchContentKeyContext, executor)
                .whenCompleteAsync(this::finish, executor);
    }

    byte[] contentIdentifier() {
        URI url = request.url();
        String assetId = url == null ? null : (url.getHost() != null ? url.getHost() : url.getAuthority());
        if (assetId == null || assetId.isEmpty()) {
            throw FairplayException.of(Reason.INVALID_CONTENT_IDENTIFIER, Step.SERVER_PLAYBACK_CONTEXT,
                    "No asset id in key request url " + url);
        }
        LOGGER.fine(() -> "Fairplay key request for asset " + assetId);
        return assetId.getBytes(StandardCharsets.UTF_8);
    }

    CompletableFuture<byte[]> fetchCertificate() {
        URI certificateUri;
        try {
            certificateUri = resolve(entitlement.fairplay() == null ? null : entitlement.fairplay().certificateUrl(),
                    Reason.MISSING_CERTIFICATE_URL, Step.CERTIFICATE);
        } catch (FairplayException e) {
            return CompletableFuture.failedFuture(e);
        }
        transition(HandshakeState.CERTIFICATE_REQUESTED);
        return call(() -> transport.get(certificateUri))
                .handleAsync((response, error) -> {
                    ensureActive();
                    if (error != null) {
                        throw FairplayException.networkFailure(Step.CERTIFICATE,
                                "Application certificate request failed", unwrap(error));
                    }
                    byte[] certificate = payload(
                            FairplayEnvelope.parse(response.body(), FairplayEnvelope.CERTIFICATE_ELEMENT),
                            Step.CERTIFICATE);
                    transition(HandshakeState.CERTIFICATE_RECEIVED);
                    return certificate;
                }, executor);
    }

    byte[] buildKeyRequest(byte[] certificate, byte[] contentIdentifier) {
        ensureActive();
        byte[] spc;
        try {
            spc = request.serverPlaybackContext(certificate, contentIdentifier);
        } catch (PlatformDrmException e) {
            throw FairplayException.serverPlaybackContext(e);
        }
        transition(HandshakeState.KEY_REQUEST_BUILT);
        return spc;
    }

    CompletableFuture<byte[]> fetchContentKeyContext(byte[] spc) {
        ensureActive();
        URI licenseUri = resolve(entitlement.fairplay() == null ? null : entitlement.fairplay().licenseAcquisitionUrl(),
                Reason.MISSING_LICENSE_URL, Step.CONTENT_KEY_CONTEXT);

        Map<String, String> headers = new LinkedHashMap<>();
        if (entitlement.playToken() != null) {
            headers.put(playTokenHeader, entitlement.playToken());
        } else {
            LOGGER.warning("Entitlement carries no play token, requesting content key context without it");
        }
        headers.put("Content-type", CONTENT_TYPE);
        byte[] body = Base64.getEncoder().encode(spc);

        transition(HandshakeState.KEY_CONTEXT_REQUESTED);
        return call(() -> transport.post(licenseUri, headers, body))
                .handleAsync((response, error) -> {
                    ensureActive();
                    if (error != null) {
                        throw FairplayException.networkFailure(Step.CONTENT_KEY_CONTEXT,
                                "Content key context request failed", unwrap(error));
                    }
                    EnvelopeResult envelope = FairplayEnvelope.parse(response.body(),
                            FairplayEnvelope.CONTENT_KEY_CONTEXT_ELEMENT);
                    if (!response.isSuccessful() && envelope.getKind() != EnvelopeResult.Kind.SERVER_ERROR) {
                        throw FairplayException.networkFailure(Step.CONTENT_KEY_CONTEXT,
                                "Content key context request returned HTTP " + response.statusCode(), null);
                    }
                    return payload(envelope, Step.CONTENT_KEY_CONTEXT);
                }, executor);
    }

    private void finish(byte[] contentKeyContext, Throwable error) {
        Throwable cause = error == null ? null : unwrap(error);
        if (cause instanceof CancellationException || isDiscarded()) {
            LOGGER.fine("Key request cancelled by the platform, discarding handshake result");
            result.cancel(false);
            return;
        }
        if (cause == null) {
            try {
                complete(contentKeyContext);
                return;
            } catch (RuntimeException e) {
                cause = e;
            }
        }
        fail(cause);
    }

    private void complete(byte[] contentKeyContext) {
        if (!request.hasDataRequest()) {
            throw FairplayException.of(Reason.MISSING_DATA_REQUEST, Step.COMPLETION,
                    "Platform has no pending data request for the content key context");
        }
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            request.respond(contentKeyContext);
        } catch (RuntimeException e) {
            report(FairplayException.unexpected(Step.COMPLETION, e), true);
            return;
        }
        try {
            request.finishLoading();
        } catch (RuntimeException e) {
            // the platform has been told loading finished, it gets no second callback
            report(FairplayException.unexpected(Step.COMPLETION, e), false);
            return;
        }
        transition(HandshakeState.COMPLETED);
        result.complete(contentKeyContext);
    }

    private void fail(Throwable cause) {
        FairplayException failure = cause instanceof FairplayException
                ? (FairplayException) cause
                : FairplayException.unexpected(stepOf(state), cause);
        if (!finished.compareAndSet(false, true)) {
            result.completeExceptionally(failure);
            return;
        }
        report(failure, true);
    }

    private void report(FairplayException failure, boolean notifyPlatform) {
        transition(HandshakeState.ERRORED);
        LOGGER.log(Level.WARNING, "Fairplay handshake failed: " + failure.getMessage(), failure);
        try {
            if (notifyPlatform) {
                request.finishLoading(failure);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Platform failed to accept the handshake error", e);
        } finally {
            result.completeExceptionally(failure);
        }
    }

    private void transition(HandshakeState next) {
        HandshakeState previous = state;
        state = next;
        LOGGER.fine(() -> "Handshake " + previous + " -> " + next);
    }

    private void ensureActive() {
        if (isDiscarded()) {
            throw new CancellationException("Key request cancelled");
        }
    }

    private boolean isDiscarded() {
        return cancelled || request.isCancelled();
    }

    private static byte[] payload(EnvelopeResult envelope, Step step) {
        switch (envelope.getKind()) {
            case PAYLOAD:
                return envelope.getPayload();
            case SERVER_ERROR:
                throw FairplayException.serverError(step, envelope.getCode(), envelope.getMessage());
            default:
                throw FairplayException.of(Reason.PARSE_FAILURE, step,
                        "Unrecognized license server response: " + envelope.getMessage());
        }
    }

    private static URI resolve(String url, Reason missing, Step step) {
        if (url == null || url.isBlank()) {
            throw FairplayException.of(missing, step, "Entitlement has no " + describe(missing));
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw FairplayException.of(missing, step, "Entitlement has an invalid " + describe(missing) + ": " + url);
        }
    }

    private static String describe(Reason missing) {
        return missing == Reason.MISSING_CERTIFICATE_URL ? "certificate url" : "license acquisition url";
    }

    private static CompletableFuture<LicenseResponse> call(TransportCall call) {
        try {
            return call.send();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Step stepOf(HandshakeState state) {
        switch (state) {
            case IDLE:
            case CERTIFICATE_REQUESTED:
                return Step.CERTIFICATE;
            case CERTIFICATE_RECEIVED:
                return Step.SERVER_PLAYBACK_CONTEXT;
            case KEY_REQUEST_BUILT:
            case KEY_CONTEXT_REQUESTED:
                return Step.CONTENT_KEY_CONTEXT;
            default:
                return Step.COMPLETION;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface TransportCall {
        CompletableFuture<LicenseResponse> send();
    }
}
