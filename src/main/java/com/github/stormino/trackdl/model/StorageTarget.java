package com.github.stormino.trackdl.model;

/**
 * Where a finished download is stored.
 */
public enum StorageTarget {
    /** Saved directly in the caller's environment. */
    CLIENT,
    /** Uploaded to the server-side library. */
    SERVER
}
