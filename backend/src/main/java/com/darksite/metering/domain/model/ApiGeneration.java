package com.darksite.metering.domain.model;

/**
 * Remote control-plane API generations polled on every cycle.
 *
 * Each generation has its own wire shape, pagination convention and
 * authentication mode. The normalization layer hides these differences.
 */
public enum ApiGeneration {
    LEGACY_STATS("v2.0 stats", "/api/nutanix/v2.0", AuthMode.BASIC),
    RESOURCE_LIST("v3 resource list", "/api/nutanix/v3", AuthMode.BASIC),
    FILE_SERVICE("v4.0 files", "/api/files/v4.0", AuthMode.SESSION_TOKEN);

    private final String displayName;
    private final String basePath;
    private final AuthMode authMode;

    ApiGeneration(String displayName, String basePath, AuthMode authMode) {
        this.displayName = displayName;
        this.basePath = basePath;
        this.authMode = authMode;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getBasePath() {
        return basePath;
    }

    public AuthMode getAuthMode() {
        return authMode;
    }

    /**
     * How requests of a generation prove their identity.
     */
    public enum AuthMode {
        /** Credentials sent with every request. */
        BASIC,
        /** Issued session cookie, falling back to basic credentials when none is held. */
        SESSION_TOKEN
    }
}
