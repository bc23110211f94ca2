package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.exception.ConfigurationException;
import com.github.stormino.trackdl.exception.StorageException;
import com.github.stormino.trackdl.exception.TransportException;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.TrackPayload;
import com.github.stormino.trackdl.port.FetchOptions;
import com.github.stormino.trackdl.port.TransportPort;
import com.github.stormino.trackdl.port.TransportResponse;
import com.github.stormino.trackdl.util.DownloadConstants;
import com.github.stormino.trackdl.util.FormatUtils;
import com.github.stormino.trackdl.util.TrackFilenames;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Saves payloads into a local directory or uploads them to the server-side library.
 */
@Slf4j
public class DefaultDownloadSink implements DownloadSink {

    static final String ACTION_CREATED = "created";
    static final String ACTION_OVERWRITTEN = "overwritten";
    static final String ACTION_SKIPPED = "skipped";
    static final String ACTION_RENAMED = "renamed";

    private static final String PART_SUFFIX = ".part";

    private final Path clientDirectory;
    private final String serverUploadUrl;
    private final TransportPort transport;

    public DefaultDownloadSink(@NonNull Path clientDirectory, String serverUploadUrl, @NonNull TransportPort transport) {
        this.clientDirectory = clientDirectory;
        this.serverUploadUrl = serverUploadUrl;
        this.transport = transport;
    }

    @Override
    public DownloadResult saveLocal(TrackPayload payload, DownloadRequest request) {
        if (request.getSignal() != null) {
            request.getSignal().throwIfCancelled();
        }

        String filename = TrackFilenames.sanitizeForFilename(payload.getFilename());
        Path target = clientDirectory.resolve(filename);
        ConflictResolution policy = request.getConflictResolution() != null
                ? request.getConflictResolution()
                : ConflictResolution.OVERWRITE_IF_DIFFERENT;

        try {
            Files.createDirectories(clientDirectory);

            String action = ACTION_CREATED;
            if (Files.exists(target)) {
                switch (policy) {
                    case SKIP:
                        log.info("File exists, skipping: {}", target);
                        return skipped(target, "File already exists");
                    case OVERWRITE_IF_DIFFERENT:
                        if (hasSameContent(target, payload.getData())) {
                            log.info("Identical file exists, skipping: {}", target);
                            return skipped(target, "Identical file already exists");
                        }
                        action = ACTION_OVERWRITTEN;
                        break;
                    case RENAME:
                        target = nextFreeName(target);
                        action = ACTION_RENAMED;
                        break;
                    case OVERWRITE:
                        action = ACTION_OVERWRITTEN;
                        break;
                }
            }

            write(target, payload.getData());
            log.info("Saved {} ({}, {})", target, FormatUtils.formatSize(payload.getSize()), action);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put(DownloadResult.FILENAME, target.getFileName().toString());
            metadata.put(DownloadResult.FILEPATH, target.toString());
            metadata.put(DownloadResult.ACTION, action);
            return DownloadResult.success("Saved " + target.getFileName(), metadata);

        } catch (IOException e) {
            throw new StorageException("Failed to write " + target + ": " + e.getMessage(), e, target);
        }
    }

    @Override
    public DownloadResult saveServer(TrackPayload payload, DownloadRequest request) throws IOException {
        if (serverUploadUrl == null || serverUploadUrl.isBlank()) {
            throw new ConfigurationException("Server upload URL is not configured",
                    "trackdl.storage.server-upload-url");
        }

        ConflictResolution policy = request.getConflictResolution() != null
                ? request.getConflictResolution()
                : ConflictResolution.OVERWRITE_IF_DIFFERENT;

        FetchOptions options = FetchOptions.builder()
                .method("POST")
                .body(payload.getData())
                .contentType(payload.getContentType() != null ? payload.getContentType() : "application/octet-stream")
                .header(DownloadConstants.FILENAME_HEADER, URLEncoder.encode(payload.getFilename(), StandardCharsets.UTF_8))
                .header(DownloadConstants.CONFLICT_RESOLUTION_HEADER, policy.getWireValue())
                .header(DownloadConstants.DOWNLOAD_COVER_HEADER, String.valueOf(request.isDownloadCoversSeparately()))
                .signal(request.getSignal())
                .listener((uploaded, total) -> request.reportProgress(DownloadProgress.uploading(uploaded, total)))
                .build();

        TransportResponse response = transport.fetch(serverUploadUrl, options);
        if (!response.isSuccessful()) {
            throw new TransportException("Server upload failed with HTTP " + response.getStatusCode(),
                    serverUploadUrl, response.getStatusCode());
        }

        log.info("Uploaded {} ({}) to server", payload.getFilename(), FormatUtils.formatSize(payload.getSize()));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(DownloadResult.FILENAME, payload.getFilename());
        String body = response.bodyAsString();
        return DownloadResult.success(body.isBlank() ? "Uploaded " + payload.getFilename() : body, metadata);
    }

    private static DownloadResult skipped(Path target, String message) {
        DownloadResult result = DownloadResult.skipped(message);
        result.addMetadata(DownloadResult.FILENAME, target.getFileName().toString());
        result.addMetadata(DownloadResult.FILEPATH, target.toString());
        result.addMetadata(DownloadResult.ACTION, ACTION_SKIPPED);
        return result;
    }

    private static boolean hasSameContent(Path existing, byte[] data) throws IOException {
        byte[] content = data != null ? data : new byte[0];
        if (Files.size(existing) != content.length) {
            return false;
        }
        return Arrays.equals(Files.readAllBytes(existing), content);
    }

    /**
     * First free "name (n).ext" next to the target.
     */
    static Path nextFreeName(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";

        int counter = 1;
        Path candidate;
        do {
            candidate = target.resolveSibling(base + " (" + counter + ")" + extension);
            counter++;
        } while (Files.exists(candidate));
        return candidate;
    }

    private static void write(Path target, byte[] data) throws IOException {
        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        try {
            Files.write(part, data != null ? data : new byte[0]);
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(part);
        }
    }
}
