package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.model.ConversionResult;
import com.github.stormino.trackdl.model.ForeignTrackReference;
import com.github.stormino.trackdl.port.ConversionPort;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when no catalog matcher is configured: every conversion fails.
 */
@Slf4j
public class UnavailableConversionPort implements ConversionPort {

    static final String NOT_CONFIGURED = "no catalog converter is configured";

    @Override
    public ConversionResult convertForeignToNative(ForeignTrackReference target) {
        log.debug("Cannot convert foreign track {} ({}): {}", target.getId(), target.getSourceUrl(), NOT_CONFIGURED);
        return ConversionResult.failure(NOT_CONFIGURED);
    }
}
