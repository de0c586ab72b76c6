package com.darksite.metering.domain.model;

/**
 * Canonical units. Every metric name carries exactly one of these.
 */
public enum MetricUnit {
    /** Raw bytes, never pre-scaled. */
    BYTES,
    /** Percentage in the range 0-100. */
    PERCENT,
    /** Plain count or enumerated state value. */
    COUNT
}
