package com.heronix.callgate.service;

import java.util.List;

import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.ProtocolEventRecord;
import com.heronix.callgate.model.dto.ProtocolEventDTO;
import com.heronix.callgate.model.enums.ProtocolEventType;
import com.heronix.callgate.model.event.ProtocolEvent;
import com.heronix.callgate.repository.ProtocolEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the protocol event log.
 *
 * Events are recorded synchronously in the transaction of the state change that
 * raised them, so a rolled back change leaves no event behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolEventService {

    static final int MAX_DETAIL_LENGTH = 2000;

    private final ProtocolEventRepository eventRepository;

    // ========================================================================
    // RECORDING
    // ========================================================================

    @EventListener
    @Transactional
    public void onProtocolEvent(ProtocolEvent event) {
        String detail = event.detail();
        if (detail.length() > MAX_DETAIL_LENGTH) {
            detail = detail.substring(0, MAX_DETAIL_LENGTH - 3) + "...";
        }

        ProtocolEventRecord record = ProtocolEventRecord.builder()
                .eventType(event.type())
                .integration(event.integration())
                .detail(detail)
                .build();
        eventRepository.save(record);

        log.info("EVENT: {} [{}] {}", event.type().getDisplayName(), event.integration(), detail);
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Transactional(readOnly = true)
    public Page<ProtocolEventDTO> getEvents(int page, int size) {
        Pageable pageable = PageRequest.of(page, size);
        return eventRepository.findAllByOrderByOccurredAtDescIdDesc(pageable)
                .map(ProtocolEventDTO::fromEntity);
    }

    @Transactional(readOnly = true)
    public Page<ProtocolEventDTO> getEvents(Address integration, int page, int size) {
        Pageable pageable = PageRequest.of(page, size);
        return eventRepository.findByIntegrationOrderByOccurredAtDescIdDesc(integration, pageable)
                .map(ProtocolEventDTO::fromEntity);
    }

    /**
     * Events of one type for an identity, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ProtocolEventRecord> getEvents(Address integration, ProtocolEventType type) {
        return eventRepository.findByIntegrationAndEventTypeOrderByIdAsc(integration, type);
    }

    @Transactional(readOnly = true)
    public long countEvents(Address integration) {
        return eventRepository.countByIntegration(integration);
    }
}
