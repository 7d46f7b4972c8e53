package com.heronix.callgate.adapter.remote;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.callgate.adapter.SecurityModule;
import com.heronix.callgate.config.CallGateProperties;
import com.heronix.callgate.model.domain.ModuleId;
import com.heronix.callgate.router.ProtectedCall;

import lombok.extern.slf4j.Slf4j;

/**
 * Security module hosted as a separate service and reached over REST.
 *
 * POST {url}/validate with the protected call as JSON; the service answers
 * {@code {"permitted": true|false}}. Transport errors and malformed answers are
 * failures, never denials, and propagate to the router.
 */
@Slf4j
public class RemoteSecurityModule implements SecurityModule {

    private final ModuleId moduleId;
    private final String name;
    private final WebClient webClient;
    private final Duration timeout;

    public RemoteSecurityModule(WebClient.Builder webClientBuilder, CallGateProperties.ModuleConfig config) {
        this.moduleId = ModuleId.parse(config.getId());
        this.name = config.getName() != null ? config.getName() : config.getId();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();

        log.info("MODULE: Remote module {} ({}) at {}", name, moduleId, config.getUrl());
    }

    @Override
    public ModuleId getModuleId() {
        return moduleId;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean validate(ProtectedCall call) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("moduleId", moduleId.value());
        body.put("caller", call.caller().value());
        body.put("integration", call.integration().value());
        body.put("value", call.value().toString());
        body.put("payloadLength", call.payloadLength());
        body.put("invocationData", call.invocationDataHex());
        body.put("payload", call.payloadHex());

        Map<String, Object> response = webClient.post()
                .uri("/validate")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .block(timeout);

        Object verdict = response != null ? response.get("permitted") : null;
        if (!(verdict instanceof Boolean)) {
            throw new IllegalStateException("Module " + name + " returned no verdict");
        }

        log.debug("MODULE: {} verdict for {} -> {}: {}", name, call.caller(), call.integration(), verdict);
        return (Boolean) verdict;
    }

    @Override
    public boolean isAvailable() {
        try {
            Map<String, Object> response = webClient.get()
                    .uri("/health")
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .block(Duration.ofSeconds(5));

            return response != null && "UP".equals(response.get("status"));
        } catch (Exception e) {
            log.debug("MODULE: {} health check failed: {}", name, e.getMessage());
            return false;
        }
    }
}
