package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.ConversionResult;
import com.github.stormino.trackdl.model.ForeignTrackReference;

/**
 * Matches a foreign reference against the native catalog.
 */
public interface ConversionPort {

    ConversionResult convertForeignToNative(ForeignTrackReference target);
}
