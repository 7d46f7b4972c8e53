package com.heronix.callgate.adapter;

import com.heronix.callgate.model.domain.ModuleId;
import com.heronix.callgate.router.ProtectedCall;

/**
 * A security module renders the permit/deny verdict for protected calls.
 *
 * Modules are installed in the router and selected by the module id carried in the
 * call payload. The decision logic belongs to the module; the protocol only forwards.
 */
public interface SecurityModule {

    /**
     * Id under which this module is installed.
     */
    ModuleId getModuleId();

    /**
     * Friendly name for logs and health details.
     */
    String getName();

    /**
     * Decide whether a protected call may proceed.
     *
     * @return {@code true} to permit, {@code false} to deny
     * @throws RuntimeException when the module cannot render a verdict; never mapped to a denial
     */
    boolean validate(ProtectedCall call);

    /**
     * Whether the module can currently be reached.
     */
    default boolean isAvailable() {
        return true;
    }
}
