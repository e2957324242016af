package com.arborkernel.infrastructure.security;

/**
 * Security Kernel - single decision point for capability-based authorization.
 */
public interface SecurityKernel {

    /**
     * Decide whether a principal may perform an action on a resource.
     * Never throws for a denial; collaborator failures resolve to a denial.
     */
    AuthorizationDecision authorize(String principalId, String resourceUri, String action,
                                    AuthorizationOptions options);

    default AuthorizationDecision authorize(String principalId, String resourceUri, String action) {
        return authorize(principalId, resourceUri, action, AuthorizationOptions.none());
    }

    /**
     * Like {@link #authorize} but throwing on anything other than an authorization.
     *
     * @return the authorizing capability id
     * @throws TrustedSecurityKernel.AccessDeniedException when denied
     * @throws ApprovalPendingException when approval is pending
     */
    default String enforce(String principalId, String resourceUri, String action, AuthorizationOptions options) {
        AuthorizationDecision decision = authorize(principalId, resourceUri, action, options);
        switch (decision.getOutcome()) {
            case AUTHORIZED:
                return decision.getCapabilityId();
            case PENDING_APPROVAL:
                throw new ApprovalPendingException(decision.getProposalId());
            case DENIED:
            default:
                throw new TrustedSecurityKernel.AccessDeniedException(decision.getReason());
        }
    }

    default String enforce(String principalId, String resourceUri, String action) {
        return enforce(principalId, resourceUri, action, AuthorizationOptions.none());
    }
}
