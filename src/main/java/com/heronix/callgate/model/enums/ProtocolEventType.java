package com.heronix.callgate.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of protocol notifications recorded in the event log.
 */
@Getter
@RequiredArgsConstructor
public enum ProtocolEventType {

    SECURITY_ADMIN_TRANSFER_STARTED("Security admin transfer started"),

    SECURITY_ADMIN_TRANSFERRED("Security admin transferred"),

    REGISTRATION_STATUS_UPDATED("Registration status updated"),

    AUTHORIZATION_STATUS_UPDATED("Authorization status updated"),

    FUNCTION_PROTECTION_UPDATED("Function protection status updated"),

    UPGRADE_PRE_AUTHORIZED("Implementation upgrade pre-authorized"),

    IMPLEMENTATION_UPGRADED("Implementation upgraded");

    private final String displayName;
}
