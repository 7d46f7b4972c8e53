package com.heronix.callgate.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Heronix CallGate.
 */
@Data
@ConfigurationProperties(prefix = "heronix.callgate")
public class CallGateProperties {

    /**
     * Protocol router configuration
     */
    private RouterConfig router = new RouterConfig();

    /**
     * GateKeeper ledger configuration
     */
    private GateKeeperConfig gatekeeper = new GateKeeperConfig();

    /**
     * Registrar credential verification
     */
    private RegistrarConfig registrar = new RegistrarConfig();

    /**
     * Installed security modules
     */
    private List<ModuleConfig> modules = new ArrayList<>();

    /**
     * Operator console (administrator REST endpoints)
     */
    private ConsoleConfig console = new ConsoleConfig();

    @Data
    public static class RouterConfig {
        /**
         * Address of the router; the GateKeeper only accepts privileged calls from it
         */
        private String address = "0x00000000000000000000000000000000000000a1";

        /**
         * Addresses allowed to override ledger status through the router
         */
        private List<String> protocolAdmins = new ArrayList<>();
    }

    @Data
    public static class GateKeeperConfig {
        /**
         * Address of the GateKeeper ledger
         */
        private String address = "0x00000000000000000000000000000000000000b2";
    }

    @Data
    public static class RegistrarConfig {
        /**
         * Registrar public key, Base64-encoded X.509 (EC P-256).
         * In production, use environment variable: CALLGATE_REGISTRAR_PUBLIC_KEY
         */
        private String publicKey;

        /**
         * JCA signature algorithm applied to the 64-byte r||s part of the credential
         */
        private String algorithm = "SHA256withECDSAinP1363Format";
    }

    @Data
    public static class ModuleConfig {
        /**
         * 32-byte module id (0x-prefixed hex) carried in protected-call payloads
         */
        private String id;

        /**
         * Friendly name for logs and health details
         */
        private String name;

        /**
         * Base URL of the module service (POST /validate, GET /health)
         */
        private String url;

        /**
         * Request timeout in seconds
         */
        private int timeoutSeconds = 10;

        /**
         * Enable this module
         */
        private boolean enabled = true;
    }

    @Data
    public static class ConsoleConfig {
        /**
         * Address the console acts as when calling router administrator operations
         */
        private String operatorAddress;

        /**
         * HTTP Basic username of the protocol operator
         */
        private String operatorUsername = "operator";

        /**
         * BCrypt hash of the operator password
         */
        private String operatorPasswordHash;
    }
}
