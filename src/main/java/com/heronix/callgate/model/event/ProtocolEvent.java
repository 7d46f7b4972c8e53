package com.heronix.callgate.model.event;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.ProtocolEventType;
import com.heronix.callgate.model.enums.RegistrationStatus;

/**
 * Notification emitted once per protocol state change.
 *
 * Events are published through Spring's {@code ApplicationEventPublisher} and are for
 * observability only; nothing in the protocol reacts to them.
 */
public interface ProtocolEvent {

    ProtocolEventType type();

    /**
     * Identity the event is about.
     */
    Address integration();

    /**
     * Human-readable summary stored in the event log.
     */
    String detail();

    // ========================================================================
    // ADMINISTRATION
    // ========================================================================

    record SecurityAdminTransferStarted(
            Address integration,
            Address currentAdmin,
            Address pendingAdmin
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.SECURITY_ADMIN_TRANSFER_STARTED;
        }

        @Override
        public String detail() {
            return "currentAdmin=" + currentAdmin + " pendingAdmin=" + pendingAdmin;
        }
    }

    record SecurityAdminTransferred(
            Address integration,
            Address previousAdmin,
            Address newAdmin
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.SECURITY_ADMIN_TRANSFERRED;
        }

        @Override
        public String detail() {
            return "previousAdmin=" + previousAdmin + " newAdmin=" + newAdmin;
        }
    }

    // ========================================================================
    // LEDGER
    // ========================================================================

    record RegistrationStatusUpdated(
            Address integration,
            RegistrationStatus previousStatus,
            RegistrationStatus status
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.REGISTRATION_STATUS_UPDATED;
        }

        @Override
        public String detail() {
            return previousStatus + " -> " + status;
        }
    }

    record AuthorizationStatusUpdated(
            Address integration,
            AuthorizationStatus previousStatus,
            AuthorizationStatus status
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.AUTHORIZATION_STATUS_UPDATED;
        }

        @Override
        public String detail() {
            return previousStatus + " -> " + status;
        }
    }

    record FunctionProtectionStatusUpdated(
            Address integration,
            List<Selector> selectors,
            List<Boolean> flags
    ) implements ProtocolEvent {

        public FunctionProtectionStatusUpdated {
            selectors = List.copyOf(selectors);
            flags = List.copyOf(flags);
        }

        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.FUNCTION_PROTECTION_UPDATED;
        }

        @Override
        public String detail() {
            return IntStream.range(0, selectors.size())
                    .mapToObj(i -> selectors.get(i) + "=" + flags.get(i))
                    .collect(Collectors.joining(",", "[", "]"));
        }
    }

    // ========================================================================
    // UPGRADES
    // ========================================================================

    record UpgradePreAuthorized(
            Address integration,
            Address currentImplementation,
            Address newImplementation
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.UPGRADE_PRE_AUTHORIZED;
        }

        @Override
        public String detail() {
            return "current=" + currentImplementation + " new=" + newImplementation;
        }
    }

    record ImplementationUpgraded(
            Address integration,
            Address previousImplementation,
            Address newImplementation
    ) implements ProtocolEvent {
        @Override
        public ProtocolEventType type() {
            return ProtocolEventType.IMPLEMENTATION_UPGRADED;
        }

        @Override
        public String detail() {
            return "previous=" + previousImplementation + " new=" + newImplementation;
        }
    }
}
