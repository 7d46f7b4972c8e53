package com.heronix.callgate.integration;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.event.ProtocolEvent;

/**
 * Two-step security admin handover.
 *
 * The current admin nominates a pending admin; only the nominee can complete the
 * transfer. There is no way to leave an integration without an admin.
 */
public class AdminTransfer {

    private Address admin;
    private Address pendingAdmin;

    public Address getAdmin() {
        return admin;
    }

    public Address getPendingAdmin() {
        return pendingAdmin;
    }

    public boolean isAdmin(Address caller) {
        return admin != null && admin.equals(caller);
    }

    /**
     * Set the first admin. Only valid while no admin is set.
     */
    void initialize(Address initialAdmin) {
        if (initialAdmin == null) {
            throw new ProtocolException(ProtocolError.INVALID_ADMIN);
        }
        if (admin != null) {
            throw new ProtocolException(ProtocolError.ALREADY_INITIALIZED);
        }
        this.admin = initialAdmin;
    }

    public ProtocolEvent.SecurityAdminTransferStarted transferAdministration(
            Address integration, Address caller, Address newAdmin) {
        requireAdmin(caller);
        if (newAdmin == null) {
            throw new ProtocolException(ProtocolError.INVALID_ADMIN);
        }

        this.pendingAdmin = newAdmin;
        return new ProtocolEvent.SecurityAdminTransferStarted(integration, admin, newAdmin);
    }

    public ProtocolEvent.SecurityAdminTransferred acceptAdministration(Address integration, Address caller) {
        if (pendingAdmin == null || !pendingAdmin.equals(caller)) {
            throw new ProtocolException(ProtocolError.NOT_PENDING_ADMIN);
        }

        Address previous = admin;
        this.admin = caller;
        this.pendingAdmin = null;
        return new ProtocolEvent.SecurityAdminTransferred(integration, previous, caller);
    }

    public void requireAdmin(Address caller) {
        if (!isAdmin(caller)) {
            throw new ProtocolException(ProtocolError.NOT_SECURITY_ADMIN);
        }
    }

    void restore(Address admin, Address pendingAdmin) {
        this.admin = admin;
        this.pendingAdmin = pendingAdmin;
    }
}
