package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.model.ServerSaveResult;

import java.io.IOException;

/**
 * Save operations backing the client and server execution strategies.
 */
public interface DownloadExecutionPort {

    /**
     * Saves the track in the caller's environment. Progress is reported already phase-tagged.
     *
     * @throws IOException when the transfer or the write fails
     */
    void downloadToClient(NativeTrack track, AudioQuality quality, String filename,
                          ClientDownloadOptions options) throws IOException;

    /**
     * Has the server fetch, tag and store the track.
     *
     * @throws IOException when the server cannot be reached
     */
    ServerSaveResult downloadToServer(NativeTrack track, AudioQuality quality,
                                      ServerDownloadOptions options) throws IOException;
}
