package com.github.stormino.trackdl.model;

/**
 * Execution backend used to perform a download.
 */
public enum ExecutionStrategyType {
    CLIENT,
    SERVER,
    COORDINATOR;

    /**
     * Strategy implied by a storage target when none was chosen explicitly.
     */
    public static ExecutionStrategyType forStorage(StorageTarget storage) {
        return storage == StorageTarget.SERVER ? SERVER : CLIENT;
    }
}
