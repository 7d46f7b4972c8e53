package com.heronix.callgate.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Structured failure reasons of the protocol.
 *
 * The enum name is the code returned to callers.
 */
@Getter
@RequiredArgsConstructor
public enum ProtocolError {

    // Caller errors
    NOT_SECURITY_ADMIN(Category.CALLER, "Caller is not the security admin"),
    NOT_PENDING_ADMIN(Category.CALLER, "Caller is not the pending security admin"),
    INVALID_ADMIN(Category.CALLER, "Security admin must be a valid address"),
    NOT_ROUTER(Category.CALLER, "Caller is not the protocol router"),
    NOT_PROTOCOL_ADMIN(Category.CALLER, "Caller is not a protocol administrator"),
    NOT_SELF(Category.CALLER, "Caller may only modify its own ledger entries"),
    ARRAY_LENGTH_MISMATCH(Category.CALLER, "Selector and flag arrays differ in length"),
    INVALID_FLAG(Category.CALLER, "Selector and flag entries must not be empty"),
    INVALID_CREDENTIAL_LENGTH(Category.CALLER, "Registrar credential has an invalid length"),
    INVALID_REGISTRAR_SIGNATURE(Category.CALLER, "Registrar credential is not valid for this integration"),
    PAYLOAD_TOO_SHORT(Category.CALLER, "Protected call payload is too short"),
    DELEGATION_NOT_PERMITTED(Category.CALLER, "Operation cannot be executed against foreign storage"),
    DIRECT_CALL_NOT_PERMITTED(Category.CALLER, "Operation must be invoked through its proxy"),
    ONLY_DISTINCT_IMPLEMENTATION(Category.CALLER, "New implementation must differ from the current one"),

    // State errors
    NOT_REGISTERED_PENDING(Category.STATE, "Integration is not pending registration"),
    ALREADY_REGISTERED(Category.STATE, "Integration has already completed registration"),
    INTEGRATION_NOT_REGISTERED(Category.STATE, "Integration is not registered"),
    INTEGRATION_NOT_ACTIVE(Category.STATE, "Integration is not authorized for protected calls"),
    INTEGRATION_REVOKED(Category.STATE, "Integration authorization has been revoked"),
    ALREADY_INITIALIZED(Category.STATE, "Integration has already been initialized"),
    REGISTRATION_FAILED(Category.STATE, "Registration could not be completed"),
    UPGRADE_NOT_PRE_AUTHORIZED(Category.STATE, "New implementation was not pre-authorized by the current one"),

    // Collaborator errors
    MODULE_DENIED(Category.COLLABORATOR, "Security module denied the call"),
    MODULE_NOT_INSTALLED(Category.COLLABORATOR, "No security module installed for the payload's module id"),
    DISPATCH_FAILED(Category.COLLABORATOR, "Protected call dispatch failed");

    private final Category category;
    private final String defaultMessage;

    public enum Category {
        CALLER,
        STATE,
        COLLABORATOR
    }
}
