package com.heronix.callgate.controller.api;

import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.dto.ProtocolEventDTO;
import com.heronix.callgate.service.ProtocolEventService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/v1/gatekeeper/events")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Protocol Events", description = "Event log of protocol state changes")
public class ProtocolEventController {

    private final ProtocolEventService eventService;

    @GetMapping
    @Operation(summary = "Get protocol events with pagination, newest first")
    public ResponseEntity<Page<ProtocolEventDTO>> getEvents(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) String integration) {

        log.debug("API: Getting events - page={}, size={}, integration={}", page, size, integration);

        Page<ProtocolEventDTO> events;
        if (integration != null && !integration.isBlank()) {
            events = eventService.getEvents(Address.of(integration), page, size);
        } else {
            events = eventService.getEvents(page, size);
        }

        return ResponseEntity.ok(events);
    }
}
