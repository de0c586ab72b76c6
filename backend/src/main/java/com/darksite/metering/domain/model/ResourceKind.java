package com.darksite.metering.domain.model;

/**
 * Kinds of control-plane resources the engine meters.
 */
public enum ResourceKind {
    CLUSTER("Cluster"),
    HOST("Host"),
    VM("VM"),
    STORAGE_CONTAINER("StorageContainer"),
    FILE_SERVER("FileServer");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
