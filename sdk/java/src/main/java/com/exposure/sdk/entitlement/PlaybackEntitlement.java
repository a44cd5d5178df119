package com.exposure.sdk.entitlement;

import com.exposure.sdk.util.ExposureDates;

import java.time.Instant;
import java.util.Optional;

/**
 * Server issued permission describing what may be played and under which constraints.
 *
 * <p>Every component is nullable: the server omits fields depending on the licensing outcome.
 *
 * @param playToken           play token for the DRM license server, absent unless the play succeeded
 * @param edrm                EDRM configuration
 * @param fairplay            Fairplay configuration
 * @param mediaLocator        media uid for EDRM, URL of the media otherwise
 * @param licenseExpiration   expiration of the DRM license
 * @param licenseExpirationReason reason of the license expiration
 * @param licenseActivation   activation of the DRM license
 * @param playTokenExpiration the play call must be made before this
 * @param entitlementType     type of entitlement that granted access
 * @param live                live entitlement
 * @param playSessionId       analytics events for this session are reported on this id
 * @param ffEnabled           fast forward allowed
 * @param timeshiftEnabled    timeshift allowed
 * @param rwEnabled           rewind allowed
 * @param minBitrate          minimum bitrate to use
 * @param maxBitrate          maximum bitrate to use
 * @param maxResHeight        maximum vertical resolution
 * @param airplayBlocked      airplay blocked
 * @param mdnRequestRouterUrl MDN request router URL
 */
public record PlaybackEntitlement(
        String playToken,
        EdrmConfiguration edrm,
        FairplayConfiguration fairplay,
        String mediaLocator,
        String licenseExpiration,
        ExpirationReason licenseExpirationReason,
        String licenseActivation,
        String playTokenExpiration,
        EntitlementType entitlementType,
        Boolean live,
        String playSessionId,
        Boolean ffEnabled,
        Boolean timeshiftEnabled,
        Boolean rwEnabled,
        Integer minBitrate,
        Integer maxBitrate,
        Integer maxResHeight,
        Boolean airplayBlocked,
        String mdnRequestRouterUrl
) {
    public Optional<Instant> licenseExpirationTime() {
        return ExposureDates.parse(licenseExpiration);
    }

    public Optional<Instant> licenseActivationTime() {
        return ExposureDates.parse(licenseActivation);
    }

    public Optional<Instant> playTokenExpirationTime() {
        return ExposureDates.parse(playTokenExpiration);
    }

    @Override
    public String toString() {
        return "PlaybackEntitlement[playSessionId=" + playSessionId
                + ", mediaLocator=" + mediaLocator
                + ", entitlementType=" + entitlementType
                + ", licenseExpirationReason=" + licenseExpirationReason
                + ", fairplay=" + (fairplay != null)
                + ", edrm=" + (edrm != null) + "]";
    }
}
