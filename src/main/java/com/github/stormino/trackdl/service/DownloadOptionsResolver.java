package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadOptions;
import com.github.stormino.trackdl.model.DownloadPreferences;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.model.ResolvedDownloadOptions;
import com.github.stormino.trackdl.model.StorageTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Merges caller options over the current preference snapshot. Explicit values always win.
 */
@Component
@RequiredArgsConstructor
public class DownloadOptionsResolver {

    private final Supplier<DownloadPreferences> preferences;

    public ResolvedDownloadOptions resolve(DownloadOptions options) {
        DownloadOptions opts = options != null ? options : DownloadOptions.defaults();
        DownloadPreferences prefs = preferences.get();

        StorageTarget storage = opts.getStorage() != null ? opts.getStorage() : prefs.getStorage();

        return ResolvedDownloadOptions.builder()
                .quality(opts.getQuality() != null ? opts.getQuality() : prefs.getDefaultQuality())
                .convertAacToMp3(opts.getConvertAacToMp3() != null
                        ? opts.getConvertAacToMp3() : prefs.isConvertAacToMp3())
                .downloadCoversSeparately(opts.getDownloadCoversSeparately() != null
                        ? opts.getDownloadCoversSeparately() : prefs.isDownloadCoversSeparately())
                .autoResolveForeign(opts.getAutoResolveForeign() != null
                        ? opts.getAutoResolveForeign() : prefs.isAutoResolveForeign())
                .notificationMode(opts.getNotificationMode() != null
                        ? opts.getNotificationMode() : prefs.getNotificationMode())
                .storage(storage)
                .strategy(opts.getStrategy() != null
                        ? opts.getStrategy() : ExecutionStrategyType.forStorage(storage))
                .conflictResolution(opts.getConflictResolution() != null
                        ? opts.getConflictResolution() : prefs.getConflictResolution())
                .subtitle(opts.getSubtitle() != null ? opts.getSubtitle() : "")
                .signal(opts.getSignal())
                .build();
    }
}
