package com.heronix.callgate.model.dto;

import java.time.LocalDateTime;

import com.heronix.callgate.model.domain.ProtocolEventRecord;
import com.heronix.callgate.model.enums.ProtocolEventType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the protocol event log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProtocolEventDTO {

    private Long id;

    private ProtocolEventType eventType;

    private String integration;

    private String detail;

    private LocalDateTime occurredAt;

    public static ProtocolEventDTO fromEntity(ProtocolEventRecord record) {
        return ProtocolEventDTO.builder()
                .id(record.getId())
                .eventType(record.getEventType())
                .integration(record.getIntegration().value())
                .detail(record.getDetail())
                .occurredAt(record.getOccurredAt())
                .build();
    }
}
