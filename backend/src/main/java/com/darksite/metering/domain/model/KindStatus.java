package com.darksite.metering.domain.model;

/**
 * How much of a collection cycle succeeded for one resource kind.
 */
public enum KindStatus {
    /**
     * Every adapter call for the kind succeeded, pagination fully drained.
     */
    COMPLETE,

    /**
     * Some records were obtained before an adapter call failed.
     */
    PARTIAL,

    /**
     * No records obtained, or every call errored.
     */
    FAILED
}
