package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.port.FetchOptions;
import com.github.stormino.trackdl.port.TransportPort;
import com.github.stormino.trackdl.port.TransportResponse;
import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * {@link TransportPort} on top of OkHttp. Timeouts and retries come from the client
 * configuration; cancellation aborts the underlying call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpTransport implements TransportPort {

    private final OkHttpClient httpClient;

    @Override
    public TransportResponse fetch(@NonNull String url, FetchOptions options) throws IOException {
        FetchOptions opts = options != null ? options : FetchOptions.get();
        CancellationSignal signal = opts.getSignal();
        throwIfCancelled(signal);

        Call call = httpClient.newCall(buildRequest(url, opts));
        if (signal != null) {
            signal.onCancel(call::cancel);
        }

        log.debug("{} {}", opts.getMethod(), url);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? readBody(body, opts) : new byte[0];
            MediaType contentType = body != null ? body.contentType() : null;

            return TransportResponse.builder()
                    .statusCode(response.code())
                    .body(bytes)
                    .contentType(contentType != null ? contentType.toString() : null)
                    .build();
        } catch (IOException e) {
            throwIfCancelled(signal);
            throw e;
        }
    }

    private Request buildRequest(String url, FetchOptions opts) {
        Request.Builder builder = new Request.Builder().url(url);
        opts.getHeaders().forEach(builder::header);

        RequestBody requestBody = null;
        if (opts.getBody() != null) {
            MediaType mediaType = opts.getContentType() != null ? MediaType.parse(opts.getContentType()) : null;
            requestBody = new ProgressRequestBody(opts.getBody(), mediaType, opts.getSignal(), opts.getListener());
        }
        return builder.method(opts.getMethod(), requestBody).build();
    }

    /**
     * Response bytes; progress is only reported for requests without a body.
     */
    private byte[] readBody(ResponseBody body, FetchOptions opts) throws IOException {
        long length = body.contentLength();
        Long total = length >= 0 ? length : null;
        boolean reportProgress = opts.getBody() == null && opts.getListener() != null;

        ByteArrayOutputStream out = new ByteArrayOutputStream(total != null ? (int) Math.min(total, Integer.MAX_VALUE) : 32 * 1024);
        byte[] buffer = new byte[DownloadConstants.TRANSFER_BUFFER_SIZE];
        long received = 0;

        try (InputStream in = body.byteStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                throwIfCancelled(opts.getSignal());
                out.write(buffer, 0, read);
                received += read;
                if (reportProgress) {
                    opts.getListener().onTransfer(received, total);
                }
            }
        }
        return out.toByteArray();
    }

    private static void throwIfCancelled(CancellationSignal signal) {
        if (signal != null) {
            signal.throwIfCancelled();
        }
    }

    /**
     * Request body that reports uploaded bytes while it is written.
     */
    static class ProgressRequestBody extends RequestBody {
        private final byte[] data;
        private final MediaType mediaType;
        private final CancellationSignal signal;
        private final FetchOptions.TransferListener listener;

        ProgressRequestBody(byte[] data, MediaType mediaType, CancellationSignal signal,
                            FetchOptions.TransferListener listener) {
            this.data = data;
            this.mediaType = mediaType;
            this.signal = signal;
            this.listener = listener;
        }

        @Nullable
        @Override
        public MediaType contentType() {
            return mediaType;
        }

        @Override
        public long contentLength() {
            return data.length;
        }

        @Override
        public void writeTo(@NotNull BufferedSink sink) throws IOException {
            int offset = 0;
            while (offset < data.length) {
                if (signal != null && signal.isCancelled()) {
                    throw new DownloadCancelledException(signal.getReason());
                }
                int chunk = Math.min(DownloadConstants.TRANSFER_BUFFER_SIZE, data.length - offset);
                sink.write(data, offset, chunk);
                offset += chunk;
                if (listener != null) {
                    listener.onTransfer(offset, (long) data.length);
                }
            }
        }
    }
}
