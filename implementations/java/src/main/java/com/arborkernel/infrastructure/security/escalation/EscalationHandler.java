package com.arborkernel.infrastructure.security.escalation;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.infrastructure.security.AuthorizationRequest;

/**
 * Decides whether an otherwise authorized request needs human approval.
 */
@FunctionalInterface
public interface EscalationHandler {

    EscalationDecision evaluate(AuthorizationRequest request, Capability capability);
}
