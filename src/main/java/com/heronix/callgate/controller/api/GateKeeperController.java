package com.heronix.callgate.controller.api;

import java.util.ArrayList;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.callgate.gatekeeper.GateKeeper;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.model.dto.FunctionProtectionDTO;
import com.heronix.callgate.model.dto.FunctionQueryRequestDTO;
import com.heronix.callgate.model.dto.IntegrationStatusDTO;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only REST view of the GateKeeper ledger.
 */
@RestController
@RequestMapping("/api/v1/gatekeeper/integrations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "GateKeeper", description = "Registration, authorization and protection flag lookups")
public class GateKeeperController {

    private final GateKeeper gateKeeper;

    @GetMapping("/{identity}")
    @Operation(summary = "Get integration status", description = "Registration and authorization status of an identity")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Status returned"),
        @ApiResponse(responseCode = "400", description = "Malformed identity")
    })
    public ResponseEntity<IntegrationStatusDTO> getStatus(
            @Parameter(description = "Identity, e.g. 0x5fbdb2315678afecb367f032d93f642f64180aa3")
            @PathVariable String identity) {

        log.debug("API: Getting status of {}", identity);
        return ResponseEntity.ok(gateKeeper.getIntegrationStatus(Address.of(identity)));
    }

    @GetMapping("/{identity}/functions/{selector}")
    @Operation(summary = "Get protection flag", description = "Whether an operation of the integration is protected")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Flag returned"),
        @ApiResponse(responseCode = "409", description = "Integration not registered")
    })
    public ResponseEntity<FunctionProtectionDTO> getFunctionProtection(
            @PathVariable String identity,
            @Parameter(description = "Selector, e.g. 0xaaaaaaaa")
            @PathVariable String selector) {

        Address address = Address.of(identity);
        Selector parsed = Selector.parse(selector);

        boolean enabled = gateKeeper.queryFlag(address, parsed);

        return ResponseEntity.ok(FunctionProtectionDTO.builder()
                .identity(address.value())
                .selector(parsed.value())
                .enabled(enabled)
                .build());
    }

    @PostMapping("/{identity}/functions/query")
    @Operation(summary = "Query protection flags", description = "Look up several protection flags in one call")
    public ResponseEntity<List<FunctionProtectionDTO>> queryFunctionProtection(
            @PathVariable String identity,
            @Valid @RequestBody FunctionQueryRequestDTO request) {

        Address address = Address.of(identity);
        List<Selector> selectors = request.getSelectors().stream()
                .map(Selector::parse)
                .toList();

        List<Boolean> flags = gateKeeper.queryFlags(address, selectors);

        List<FunctionProtectionDTO> response = new ArrayList<>(selectors.size());
        for (int i = 0; i < selectors.size(); i++) {
            response.add(FunctionProtectionDTO.builder()
                    .identity(address.value())
                    .selector(selectors.get(i).value())
                    .enabled(flags.get(i))
                    .build());
        }

        return ResponseEntity.ok(response);
    }
}
