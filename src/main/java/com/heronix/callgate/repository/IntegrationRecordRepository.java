package com.heronix.callgate.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.IntegrationRecord;
import com.heronix.callgate.model.enums.AuthorizationStatus;

/**
 * Repository for GateKeeper ledger entries.
 */
@Repository
public interface IntegrationRecordRepository extends JpaRepository<IntegrationRecord, Long> {

    /**
     * Find the ledger entry of an identity.
     */
    Optional<IntegrationRecord> findByIdentity(Address identity);

    /**
     * Find entries by authorization status.
     */
    List<IntegrationRecord> findByAuthorizationStatus(AuthorizationStatus authorizationStatus);

    /**
     * Count entries by registration status.
     */
    @Query("SELECT i.registrationStatus, COUNT(i) FROM IntegrationRecord i GROUP BY i.registrationStatus")
    List<Object[]> countByRegistrationStatus();
}
