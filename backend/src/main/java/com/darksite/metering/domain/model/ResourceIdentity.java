package com.darksite.metering.domain.model;

import java.util.Objects;

/**
 * Identity of one observed resource.
 *
 * The uuid is the join key across API generations; display names are not
 * assumed to be unique.
 */
public record ResourceIdentity(ResourceKind kind, String uuid, String displayName) {

    public ResourceIdentity {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(uuid, "uuid");
        if (displayName == null || displayName.isBlank()) {
            displayName = uuid;
        }
    }
}
