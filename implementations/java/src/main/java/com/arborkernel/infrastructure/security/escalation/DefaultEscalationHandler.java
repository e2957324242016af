package com.arborkernel.infrastructure.security.escalation;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.infrastructure.security.AuthorizationRequest;

/**
 * Lets every request through; deployments with an approval workflow replace this bean.
 */
public class DefaultEscalationHandler implements EscalationHandler {

    @Override
    public EscalationDecision evaluate(AuthorizationRequest request, Capability capability) {
        return EscalationDecision.proceed();
    }
}
