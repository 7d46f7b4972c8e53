package com.heronix.callgate.model.enums;

/**
 * Authorization state of an integration identity.
 */
public enum AuthorizationStatus {

    /**
     * Default before registration completes
     */
    INACTIVE,

    /**
     * Protected calls are forwarded to security modules
     */
    ACTIVE,

    /**
     * Protected calls are permitted without consulting a module (administrator only)
     */
    BYPASSED,

    /**
     * Protected calls always fail (administrator only)
     */
    REVOKED
}
