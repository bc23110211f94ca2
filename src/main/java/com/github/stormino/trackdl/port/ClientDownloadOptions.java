package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.DownloadProgress;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

@Value
@Builder
public class ClientDownloadOptions {
    boolean convertAacToMp3;
    boolean downloadCoversSeparately;
    CancellationSignal signal;
    Consumer<DownloadProgress> onProgress;
}
