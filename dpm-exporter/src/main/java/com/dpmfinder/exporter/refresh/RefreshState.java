package com.dpmfinder.exporter.refresh;

public enum RefreshState {
    /** No cycle has completed yet; readers get "not ready". */
    UNINITIALIZED,
    /** A cycle is running. The previous snapshot, if any, is still served unchanged. */
    REFRESHING,
    /** A complete snapshot is published and no cycle is running. */
    READY
}
