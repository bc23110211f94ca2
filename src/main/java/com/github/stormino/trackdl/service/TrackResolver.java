package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.ConversionResult;
import com.github.stormino.trackdl.model.DownloadError;
import com.github.stormino.trackdl.model.DownloadErrorCode;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.ForeignTrackReference;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.port.ConversionPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a download target into a native, downloadable track.
 * Conversion failures are never retried: they reflect a catalog mismatch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackResolver {

    static final String FOREIGN_NOT_SUPPORTED_MESSAGE =
            "Foreign tracks must be converted to the catalog first. Enable auto-conversion or convert manually.";

    private final ConversionPort conversionPort;

    public TrackResolution resolve(@NonNull DownloadTarget target, boolean autoResolve) {
        if (target instanceof NativeTrack) {
            return TrackResolution.resolved((NativeTrack) target, false);
        }
        if (!(target instanceof ForeignTrackReference)) {
            return TrackResolution.failed(DownloadError.of(DownloadErrorCode.UNKNOWN_ERROR,
                    "Unsupported download target: " + target.getClass().getSimpleName()));
        }

        if (!autoResolve) {
            log.debug("Auto-conversion disabled, rejecting foreign track {}", target.getId());
            return TrackResolution.failed(DownloadError.builder()
                    .code(DownloadErrorCode.FOREIGN_NOT_SUPPORTED)
                    .retry(false)
                    .message(FOREIGN_NOT_SUPPORTED_MESSAGE)
                    .userMessage(DownloadErrorCode.FOREIGN_NOT_SUPPORTED.getUserMessage())
                    .canConvert(true)
                    .build());
        }

        ConversionResult conversion;
        try {
            conversion = conversionPort.convertForeignToNative((ForeignTrackReference) target);
        } catch (RuntimeException e) {
            log.warn("Conversion of foreign track {} threw: {}", target.getId(), e.getMessage(), e);
            conversion = ConversionResult.failure(e.getMessage(), e);
        }

        if (conversion == null || !conversion.isSuccess() || conversion.getTrack() == null) {
            String reason = conversion != null && conversion.getErrorMessage() != null
                    ? conversion.getErrorMessage()
                    : "Unknown error";
            log.info("Conversion of foreign track {} failed: {}", target.getId(), reason);
            return TrackResolution.failed(DownloadError.of(DownloadErrorCode.CONVERSION_FAILED,
                    "Auto-conversion failed: " + reason,
                    conversion != null ? conversion.getCause() : null));
        }

        log.debug("Converted foreign track {} to native track {}", target.getId(), conversion.getTrack().getId());
        return TrackResolution.resolved(conversion.getTrack(), true);
    }
}
