package com.heronix.callgate.model.dto;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.IntegrationRecord;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;

/**
 * Read-only view of an identity's ledger status.
 */
public record IntegrationStatusDTO(
        String identity,
        RegistrationStatus registrationStatus,
        AuthorizationStatus authorizationStatus
) {
    public static IntegrationStatusDTO fromEntity(IntegrationRecord record) {
        return new IntegrationStatusDTO(
                record.getIdentity().value(),
                record.getRegistrationStatus(),
                record.getAuthorizationStatus());
    }

    public static IntegrationStatusDTO unknown(Address identity) {
        return new IntegrationStatusDTO(
                identity.value(),
                RegistrationStatus.UNREGISTERED,
                AuthorizationStatus.INACTIVE);
    }
}
