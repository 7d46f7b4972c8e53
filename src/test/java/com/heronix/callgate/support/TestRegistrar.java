package com.heronix.callgate.support;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.Arrays;
import java.util.Base64;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.router.EcdsaRegistrarSignatureVerifier;

/**
 * Off-line registrar for tests: issues credentials with a throwaway P-256 key.
 */
public final class TestRegistrar {

    private static final KeyPair KEY_PAIR = generate();

    private TestRegistrar() {
    }

    public static String publicKeyBase64() {
        return Base64.getEncoder().encodeToString(KEY_PAIR.getPublic().getEncoded());
    }

    /**
     * 65-byte credential for {@code integration} administered by {@code admin}.
     */
    public static byte[] credential(Address integration, Address admin) {
        return credential(KEY_PAIR, integration, admin);
    }

    public static byte[] credential(KeyPair keyPair, Address integration, Address admin) {
        try {
            Signature signature = Signature.getInstance("SHA256withECDSAinP1363Format");
            signature.initSign(keyPair.getPrivate());
            signature.update(EcdsaRegistrarSignatureVerifier.signedMessage(integration, admin));
            byte[] rs = signature.sign();

            byte[] credential = Arrays.copyOf(rs, 65);
            credential[64] = 27;
            return credential;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public static KeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
