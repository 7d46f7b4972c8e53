package com.heronix.callgate.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.callgate.adapter.SecurityModule;
import com.heronix.callgate.router.ProtocolRouter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for installed security modules.
 *
 * Reports DOWN when any module is unreachable; protected calls routed to it fail.
 */
@Component
@RequiredArgsConstructor
public class ModuleHealthIndicator implements HealthIndicator {

    private final ProtocolRouter router;

    @Override
    public Health health() {
        Map<String, String> modules = new LinkedHashMap<>();
        boolean allAvailable = true;

        for (SecurityModule module : router.getInstalledModules()) {
            boolean available = module.isAvailable();
            allAvailable &= available;
            modules.put(module.getName(), available ? "reachable" : "unreachable");
        }

        Health.Builder builder = allAvailable ? Health.up() : Health.down();
        return builder
                .withDetail("router", router.getAddress().value())
                .withDetail("modules", modules)
                .build();
    }
}
