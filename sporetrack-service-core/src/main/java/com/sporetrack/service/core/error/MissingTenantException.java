package com.sporetrack.service.core.error;

import java.util.UUID;

/** The referenced site has no resolvable tenant. Always rejects the write. */
public class MissingTenantException extends SporetrackException {

    private final UUID siteId;

    public MissingTenantException(UUID siteId, String message) {
        super(message);
        this.siteId = siteId;
    }

    public UUID getSiteId() {
        return siteId;
    }
}
