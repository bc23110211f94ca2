package com.github.stormino.trackdl.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Formatting of sizes and speeds for log output.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= DownloadConstants.BYTES_PER_GB) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / (double) DownloadConstants.BYTES_PER_GB);
        } else if (bytes >= DownloadConstants.BYTES_PER_MB) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (double) DownloadConstants.BYTES_PER_MB);
        } else if (bytes >= DownloadConstants.BYTES_PER_KB) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / (double) DownloadConstants.BYTES_PER_KB);
        } else {
            return String.format(Locale.ROOT, "%d B", bytes);
        }
    }

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MB/s" or "512 B/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond >= DownloadConstants.BYTES_PER_MB) {
            return String.format(Locale.ROOT, "%.2f MB/s", bytesPerSecond / DownloadConstants.BYTES_PER_MB);
        } else if (bytesPerSecond >= DownloadConstants.BYTES_PER_KB) {
            return String.format(Locale.ROOT, "%.2f KB/s", bytesPerSecond / DownloadConstants.BYTES_PER_KB);
        } else {
            return String.format(Locale.ROOT, "%.0f B/s", bytesPerSecond);
        }
    }
}
