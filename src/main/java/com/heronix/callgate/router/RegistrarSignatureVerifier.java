package com.heronix.callgate.router;

import com.heronix.callgate.model.domain.Address;

/**
 * Verifies registrar-issued credentials during registration.
 *
 * The router treats implementations as an oracle: the credential either entitles
 * {@code integration} (administered by {@code admin}) to complete registration or it does not.
 */
public interface RegistrarSignatureVerifier {

    /**
     * Length of a well-formed credential.
     */
    int CREDENTIAL_LENGTH = 65;

    boolean verify(Address integration, Address admin, byte[] credential);
}
