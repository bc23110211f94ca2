package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.ServerDownloadProgress;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

@Value
@Builder
public class ServerDownloadOptions {
    boolean downloadCoversSeparately;
    ConflictResolution conflictResolution;
    CancellationSignal signal;
    Consumer<ServerDownloadProgress> onProgress;
}
