package com.heronix.callgate.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.callgate.adapter.SecurityModule;
import com.heronix.callgate.adapter.remote.RemoteSecurityModule;
import com.heronix.callgate.model.domain.ModuleId;

import lombok.extern.slf4j.Slf4j;

/**
 * Configuration for installed security modules.
 *
 * Collects every SecurityModule bean plus one RemoteSecurityModule per enabled
 * {@code heronix.callgate.modules[*]} entry, indexed by module id.
 */
@Configuration
@Slf4j
public class SecurityModuleConfig {

    /**
     * Create the map of installed modules indexed by module id.
     *
     * @param moduleBeans      SecurityModule beans defined in the context
     * @param webClientBuilder builder for remote modules
     * @param properties       module configuration
     * @return map of ModuleId -> SecurityModule
     */
    @Bean
    public Map<ModuleId, SecurityModule> securityModules(
            ObjectProvider<SecurityModule> moduleBeans,
            WebClient.Builder webClientBuilder,
            CallGateProperties properties) {

        Map<ModuleId, SecurityModule> moduleMap = new HashMap<>();

        moduleBeans.orderedStream().forEach(module -> install(moduleMap, module));

        for (CallGateProperties.ModuleConfig config : properties.getModules()) {
            if (!config.isEnabled()) {
                log.info("MODULE: Skipping disabled module {}", config.getName());
                continue;
            }
            install(moduleMap, new RemoteSecurityModule(webClientBuilder.clone(), config));
        }

        return moduleMap;
    }

    private void install(Map<ModuleId, SecurityModule> moduleMap, SecurityModule module) {
        SecurityModule previous = moduleMap.putIfAbsent(module.getModuleId(), module);
        if (previous != null) {
            throw new IllegalStateException("Duplicate security module id " + module.getModuleId()
                    + " (" + previous.getName() + ", " + module.getName() + ")");
        }
    }
}
