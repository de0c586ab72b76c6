package com.darksite.metering.adapters;

/**
 * Unit a raw value arrives in, before normalization.
 */
public enum SourceUnit {
    /** Parts per million; 10000 ppm is one percent. */
    PPM,
    PERCENT,
    BYTES,
    /** Mebibytes; 1048576 bytes each. */
    MIB,
    COUNT,
    /** Power state string such as ON or OFF. */
    POWER_STATE
}
