package com.heronix.callgate.router;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

import org.springframework.stereotype.Component;

import com.heronix.callgate.config.CallGateProperties;
import com.heronix.callgate.model.domain.Address;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies registrar credentials signed with the registrar's EC P-256 key.
 *
 * Credential layout (65 bytes):
 * [32-byte r][32-byte s][1-byte recovery id: 0, 1, 27 or 28]
 *
 * The signed message is the 20-byte integration address followed by the 20-byte admin address.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EcdsaRegistrarSignatureVerifier implements RegistrarSignatureVerifier {

    private static final int SIGNATURE_LENGTH = 64;

    private final CallGateProperties properties;
    private PublicKey registrarKey;

    @PostConstruct
    void init() {
        String encodedKey = properties.getRegistrar().getPublicKey();
        if (encodedKey == null || encodedKey.isBlank()) {
            log.error("REGISTRAR: No registrar public key configured! Every registration will be rejected.");
            return;
        }

        try {
            byte[] keyBytes = Base64.getDecoder().decode(encodedKey.trim());
            this.registrarKey = KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(keyBytes));
            log.info("REGISTRAR: Signature verifier initialized ({})", properties.getRegistrar().getAlgorithm());
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IllegalStateException("Invalid registrar public key", e);
        }
    }

    @Override
    public boolean verify(Address integration, Address admin, byte[] credential) {
        if (registrarKey == null) {
            log.warn("REGISTRAR: Rejecting credential for {} - verifier has no key", integration);
            return false;
        }
        if (credential == null || credential.length != CREDENTIAL_LENGTH) {
            return false;
        }

        int recoveryId = credential[SIGNATURE_LENGTH] & 0xff;
        if (recoveryId != 0 && recoveryId != 1 && recoveryId != 27 && recoveryId != 28) {
            log.debug("REGISTRAR: Unexpected recovery id {} for {}", recoveryId, integration);
            return false;
        }

        try {
            Signature signature = Signature.getInstance(properties.getRegistrar().getAlgorithm());
            signature.initVerify(registrarKey);
            signature.update(signedMessage(integration, admin));
            return signature.verify(Arrays.copyOf(credential, SIGNATURE_LENGTH));
        } catch (GeneralSecurityException e) {
            // malformed r/s values surface as SignatureException
            log.debug("REGISTRAR: Credential for {} could not be verified: {}", integration, e.getMessage());
            return false;
        }
    }

    /**
     * Bytes the registrar signs for an (integration, admin) pair.
     */
    public static byte[] signedMessage(Address integration, Address admin) {
        byte[] message = new byte[Address.LENGTH * 2];
        System.arraycopy(integration.toBytes(), 0, message, 0, Address.LENGTH);
        System.arraycopy(admin.toBytes(), 0, message, Address.LENGTH, Address.LENGTH);
        return message;
    }
}
