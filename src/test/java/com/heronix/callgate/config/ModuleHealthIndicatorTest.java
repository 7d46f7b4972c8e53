package com.heronix.callgate.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.heronix.callgate.adapter.SecurityModule;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.router.ProtocolRouter;

class ModuleHealthIndicatorTest {

    private final ProtocolRouter router = mock(ProtocolRouter.class);
    private final ModuleHealthIndicator indicator = new ModuleHealthIndicator(router);

    @Test
    void upWhenEveryModuleIsReachable() {
        when(router.getAddress()).thenReturn(Address.random());
        when(router.getInstalledModules()).thenReturn(List.of(module("alpha", true), module("beta", true)));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("modules"))
                .isEqualTo(Map.of("alpha", "reachable", "beta", "reachable"));
    }

    @Test
    void downWhenAnyModuleIsUnreachable() {
        when(router.getAddress()).thenReturn(Address.random());
        when(router.getInstalledModules()).thenReturn(List.of(module("alpha", true), module("beta", false)));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    private static SecurityModule module(String name, boolean available) {
        SecurityModule module = mock(SecurityModule.class);
        when(module.getName()).thenReturn(name);
        when(module.isAvailable()).thenReturn(available);
        return module;
    }
}
