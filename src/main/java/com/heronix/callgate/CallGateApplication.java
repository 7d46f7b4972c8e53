package com.heronix.callgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.callgate.config.CallGateProperties;

/**
 * Heronix CallGate - call-gating protocol for protected integrations
 *
 * Integrations opt operations into a per-call security check. A shared router asks
 * an installed security module for a permit/deny verdict; the GateKeeper ledger keeps
 * registration, authorization and protection flags.
 */
@SpringBootApplication
@EnableConfigurationProperties(CallGateProperties.class)
public class CallGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallGateApplication.class, args);
    }
}
