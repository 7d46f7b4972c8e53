package com.heronix.callgate.repository;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.ProtocolEventRecord;
import com.heronix.callgate.model.enums.ProtocolEventType;

/**
 * Repository for the protocol event log.
 */
@Repository
public interface ProtocolEventRepository extends JpaRepository<ProtocolEventRecord, Long> {

    Page<ProtocolEventRecord> findAllByOrderByOccurredAtDescIdDesc(Pageable pageable);

    Page<ProtocolEventRecord> findByIntegrationOrderByOccurredAtDescIdDesc(Address integration, Pageable pageable);

    List<ProtocolEventRecord> findByIntegrationAndEventTypeOrderByIdAsc(Address integration, ProtocolEventType eventType);

    long countByIntegration(Address integration);
}
