package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.ConversionResult;
import com.github.stormino.trackdl.model.DownloadErrorCode;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.testsupport.TestTracks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrackResolver")
class TrackResolverTest {

    private final AtomicInteger conversions = new AtomicInteger();

    @Test
    @DisplayName("native track resolves to itself without conversion")
    void nativeTrack() {
        TrackResolver resolver = new TrackResolver(target -> {
            conversions.incrementAndGet();
            return ConversionResult.failure("unused");
        });
        NativeTrack track = TestTracks.nativeTrack("1");

        TrackResolution resolution = resolver.resolve(track, true);

        assertTrue(resolution.isSuccess());
        assertSame(track, resolution.getTrack());
        assertFalse(resolution.isConverted());
        assertEquals(0, conversions.get());
    }

    @Test
    @DisplayName("foreign track with auto-resolve disabled is rejected as convertible")
    void foreignWithoutAutoResolve() {
        TrackResolver resolver = new TrackResolver(target -> {
            conversions.incrementAndGet();
            return ConversionResult.success(TestTracks.nativeTrack("2"));
        });

        TrackResolution resolution = resolver.resolve(TestTracks.foreignTrack("sp-1"), false);

        assertFalse(resolution.isSuccess());
        assertEquals(DownloadErrorCode.FOREIGN_NOT_SUPPORTED, resolution.getError().getCode());
        assertFalse(resolution.getError().isRetry());
        assertTrue(resolution.getError().isCanConvert());
        assertEquals(TrackResolver.FOREIGN_NOT_SUPPORTED_MESSAGE, resolution.getError().getMessage());
        assertEquals(0, conversions.get());
    }

    @Test
    @DisplayName("successful conversion yields the converted native track")
    void conversionSuccess() {
        NativeTrack converted = TestTracks.nativeTrack("42");
        TrackResolver resolver = new TrackResolver(target -> ConversionResult.success(converted));

        TrackResolution resolution = resolver.resolve(TestTracks.foreignTrack("sp-1"), true);

        assertTrue(resolution.isSuccess());
        assertSame(converted, resolution.getTrack());
        assertTrue(resolution.isConverted());
    }

    @Test
    @DisplayName("failed conversion carries the reason and is not retryable")
    void conversionFailure() {
        TrackResolver resolver = new TrackResolver(target -> ConversionResult.failure("No match found"));

        TrackResolution resolution = resolver.resolve(TestTracks.foreignTrack("sp-1"), true);

        assertFalse(resolution.isSuccess());
        assertEquals(DownloadErrorCode.CONVERSION_FAILED, resolution.getError().getCode());
        assertEquals("Auto-conversion failed: No match found", resolution.getError().getMessage());
        assertFalse(resolution.getError().isRetry());
    }

    @Test
    @DisplayName("failure without reason reports an unknown error")
    void conversionFailureWithoutReason() {
        TrackResolver resolver = new TrackResolver(target -> ConversionResult.failure(null));

        TrackResolution resolution = resolver.resolve(TestTracks.foreignTrack("sp-1"), true);

        assertEquals("Auto-conversion failed: Unknown error", resolution.getError().getMessage());
    }

    @Test
    @DisplayName("exception thrown by the converter is captured")
    void conversionThrows() {
        IllegalStateException boom = new IllegalStateException("catalog offline");
        TrackResolver resolver = new TrackResolver(target -> {
            throw boom;
        });

        TrackResolution resolution = resolver.resolve(TestTracks.foreignTrack("sp-1"), true);

        assertEquals(DownloadErrorCode.CONVERSION_FAILED, resolution.getError().getCode());
        assertEquals("Auto-conversion failed: catalog offline", resolution.getError().getMessage());
        assertSame(boom, resolution.getError().getCause());
    }

    @Test
    @DisplayName("unsupported target types are rejected")
    void unsupportedTarget() {
        TrackResolver resolver = new TrackResolver(target -> ConversionResult.failure("unused"));
        DownloadTarget odd = new DownloadTarget() {
            @Override
            public String getId() {
                return "odd";
            }

            @Override
            public String getTitle() {
                return null;
            }

            @Override
            public String getArtistName() {
                return null;
            }

            @Override
            public String getAlbumTitle() {
                return null;
            }

            @Override
            public boolean isForeign() {
                return false;
            }
        };

        TrackResolution resolution = resolver.resolve(odd, true);

        assertEquals(DownloadErrorCode.UNKNOWN_ERROR, resolution.getError().getCode());
    }
}
