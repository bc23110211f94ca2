package com.github.stormino.trackdl.config;

import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final DownloadProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        DownloadProperties.Transport transport = properties.getTransport();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(transport.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(transport.getTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(transport.getTimeoutSeconds()))
                .addInterceptor(new UserAgentInterceptor(transport.getUserAgent()))
                .addInterceptor(new RetryInterceptor(
                        transport.getMaxRetries(), transport.getRetryDelayMs(), transport.getMaxRetryDelayMs()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Adds the configured User-Agent unless the request already carries one.
     */
    static class UserAgentInterceptor implements Interceptor {
        private final String userAgent;

        UserAgentInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();
            if (original.header("User-Agent") != null) {
                return chain.proceed(original);
            }
            return chain.proceed(original.newBuilder()
                    .header("User-Agent", userAgent)
                    .build());
        }
    }

    /**
     * Retry interceptor with exponential backoff, capped at {@code maxDelayMs}.
     * Retries network errors and the status codes in {@link DownloadConstants#RETRYABLE_HTTP_STATUS_CODES}.
     */
    static class RetryInterceptor implements Interceptor {
        private final int maxRetries;
        private final long baseDelayMs;
        private final long maxDelayMs;

        RetryInterceptor(int maxRetries, long baseDelayMs, long maxDelayMs) {
            this.maxRetries = maxRetries;
            this.baseDelayMs = baseDelayMs;
            this.maxDelayMs = maxDelayMs;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request();
            Response response = null;
            IOException lastException = null;

            for (int attempt = 0; attempt < maxRetries; attempt++) {
                if (chain.call().isCanceled()) {
                    throw new InterruptedIOException("Request cancelled: " + request.url());
                }
                try {
                    if (response != null) {
                        response.close();
                    }

                    response = chain.proceed(request);

                    if (!isRetryable(response.code())) {
                        return response;
                    }

                    log.debug("Server error {} on attempt {}/{} for {}",
                            response.code(), attempt + 1, maxRetries, request.url());

                    if (attempt < maxRetries - 1) {
                        response.close();
                        response = null;
                        sleep(attempt);
                        continue;
                    }

                    return response;

                } catch (IOException e) {
                    if (chain.call().isCanceled()) {
                        throw e;
                    }
                    lastException = e;
                    log.warn("Network error on attempt {}/{} for {}: {}",
                            attempt + 1, maxRetries, request.url(), e.getMessage());

                    if (attempt < maxRetries - 1) {
                        sleep(attempt);
                    }
                }
            }

            if (response != null) {
                return response;
            }

            throw lastException != null ? lastException : new IOException("Max retries exceeded");
        }

        long delayFor(int attempt) {
            return Math.min(maxDelayMs, baseDelayMs * (long) Math.pow(2, attempt));
        }

        private static boolean isRetryable(int code) {
            return Arrays.stream(DownloadConstants.RETRYABLE_HTTP_STATUS_CODES).anyMatch(c -> c == code);
        }

        private void sleep(int attempt) throws InterruptedIOException {
            try {
                TimeUnit.MILLISECONDS.sleep(delayFor(attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting to retry");
            }
        }
    }
}
