package com.heronix.callgate.integration;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import com.heronix.callgate.gatekeeper.GateKeeper;
import com.heronix.callgate.router.ProtocolRouter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Protocol collaborators handed to every logic unit and host.
 */
@Component
@Getter
@RequiredArgsConstructor
public class IntegrationEnvironment {

    private final ProtocolRouter router;
    private final GateKeeper gateKeeper;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionOperations transactionOperations;
}
