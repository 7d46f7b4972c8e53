package com.heronix.callgate.controller.api;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.callgate.config.CallGateProperties;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.dto.StatusOverrideRequestDTO;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;
import com.heronix.callgate.router.ProtocolRouter;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

/**
 * Operator console for ledger overrides.
 *
 * Authenticated operators act as the configured console operator address; the router
 * still checks that address against its protocol administrator set.
 */
@RestController
@RequestMapping("/api/v1/router/admin")
@Slf4j
@Tag(name = "Router Administration", description = "Protocol administrator overrides (BYPASSED, REVOKED, ledger repair)")
public class RouterAdminController {

    private final ProtocolRouter router;
    private final Address operator;

    public RouterAdminController(ProtocolRouter router, CallGateProperties properties) {
        this.router = router;
        String operatorAddress = properties.getConsole().getOperatorAddress();
        this.operator = operatorAddress == null || operatorAddress.isBlank() ? null : Address.of(operatorAddress);
        if (operator == null) {
            log.warn("API: No console operator address configured; overrides will be rejected");
        }
    }

    @PostMapping("/authorization")
    @PreAuthorize("hasRole('PROTOCOL_ADMIN')")
    @Operation(summary = "Override authorization status", description = "Set ACTIVE, INACTIVE, BYPASSED or REVOKED for identities")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Statuses overwritten"),
        @ApiResponse(responseCode = "400", description = "Malformed request or list length mismatch"),
        @ApiResponse(responseCode = "403", description = "Operator is not a protocol administrator")
    })
    public ResponseEntity<Map<String, Object>> overrideAuthorization(@Valid @RequestBody StatusOverrideRequestDTO request) {
        List<Address> identities = parseIdentities(request);
        List<AuthorizationStatus> statuses = request.getStatuses().stream()
                .map(status -> AuthorizationStatus.valueOf(status.toUpperCase(Locale.ROOT)))
                .toList();

        log.info("API: Authorization override of {} identity(ies) by {}", identities.size(), operator);
        router.overrideAuthorizations(operator, identities, statuses);

        return ResponseEntity.ok(Map.of("updated", identities.size()));
    }

    @PostMapping("/registration")
    @PreAuthorize("hasRole('PROTOCOL_ADMIN')")
    @Operation(summary = "Override registration status", description = "Repair the registration ledger for identities")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Statuses overwritten"),
        @ApiResponse(responseCode = "400", description = "Malformed request or list length mismatch"),
        @ApiResponse(responseCode = "403", description = "Operator is not a protocol administrator")
    })
    public ResponseEntity<Map<String, Object>> overrideRegistration(@Valid @RequestBody StatusOverrideRequestDTO request) {
        List<Address> identities = parseIdentities(request);
        List<RegistrationStatus> statuses = request.getStatuses().stream()
                .map(status -> RegistrationStatus.valueOf(status.toUpperCase(Locale.ROOT)))
                .toList();

        log.info("API: Registration override of {} identity(ies) by {}", identities.size(), operator);
        router.overrideRegistrations(operator, identities, statuses);

        return ResponseEntity.ok(Map.of("updated", identities.size()));
    }

    private List<Address> parseIdentities(StatusOverrideRequestDTO request) {
        return request.getIdentities().stream()
                .map(Address::of)
                .toList();
    }
}
