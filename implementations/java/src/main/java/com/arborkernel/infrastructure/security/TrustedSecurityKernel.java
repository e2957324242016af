package com.arborkernel.infrastructure.security;

import com.arborkernel.application.CapabilityService;
import com.arborkernel.application.exceptions.CapabilityException;
import com.arborkernel.application.trust.TrustCheck;
import com.arborkernel.application.trust.TrustEngine;
import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.Capability;
import com.arborkernel.domain.model.ResourceUri;
import com.arborkernel.domain.model.TrustTier;
import com.arborkernel.infrastructure.audit.AuditService;
import com.arborkernel.infrastructure.security.constraint.ConstraintEnforcer;
import com.arborkernel.infrastructure.security.escalation.EscalationDecision;
import com.arborkernel.infrastructure.security.escalation.EscalationHandler;
import com.arborkernel.infrastructure.security.identity.IdentityVerificationException;
import com.arborkernel.infrastructure.security.identity.IdentityVerifier;
import com.arborkernel.infrastructure.security.identity.SignedRequest;
import com.arborkernel.infrastructure.security.identity.VerifiedIdentity;
import com.arborkernel.infrastructure.security.reflex.CommandReflexes;
import com.arborkernel.infrastructure.security.reflex.ReflexGuard;
import com.arborkernel.infrastructure.security.reflex.ReflexResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Trusted Security Kernel - central authorization enforcement point.
 *
 * <p>Checks run in a fixed order and the first failure decides:
 * <ol>
 *   <li>resource URI parses</li>
 *   <li>an active capability covers principal, resource and action</li>
 *   <li>identity verifies, when a signed request is supplied or policy requires one</li>
 *   <li>trust tier meets the resource's minimum and the agent is not frozen</li>
 *   <li>capability constraints hold</li>
 *   <li>escalation does not deny (it may defer to approval)</li>
 *   <li>command reflexes pass, when a command is supplied</li>
 *   <li>the capability is re-read and still active</li>
 * </ol>
 *
 * <p>Every collaborator call crosses the {@link ReflexGuard}: a collaborator
 * that throws, answers nothing or misses the reflex timeout denies with its
 * step's reason. A request denied after its constraints passed hands back
 * what those enforcers recorded for it. The
 * final re-read means a revoke that lands while a check is in flight is
 * honoured.
 *
 * <p>Public denial reasons are coarse. Whether a capability was missing,
 * revoked, expired or badly signed is reported only to the log and the audit
 * trail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustedSecurityKernel implements SecurityKernel {

    private static final String AUDIT_CATEGORY = "authorization";

    private final CapabilityService capabilityService;
    private final TrustEngine trustEngine;
    private final TrustPolicy trustPolicy;
    private final IdentityVerifier identityVerifier;
    private final List<ConstraintEnforcer> constraintEnforcers;
    private final EscalationHandler escalationHandler;
    private final CommandReflexes commandReflexes;
    private final ReflexGuard reflexGuard;
    private final AuditService auditService;
    private final KernelProperties properties;
    private final Clock clock;

    @Override
    public AuthorizationDecision authorize(String principalId, String resourceUri, String action,
                                           AuthorizationOptions options) {
        UUID requestId = UUID.randomUUID();
        AuthorizationOptions opts = options == null ? AuthorizationOptions.none() : options;

        log.debug("Authorization check [{}]: principal={}, resource={}, action={}, trace={}",
            requestId, Encode.forJava(String.valueOf(principalId)), Encode.forJava(String.valueOf(resourceUri)),
            Encode.forJava(String.valueOf(action)), opts.getTraceId());

        if (principalId == null || principalId.isBlank() || action == null || action.isBlank()) {
            return deny(requestId, principalId, resourceUri, DenialReason.UNAUTHORIZED,
                "missing principal or action");
        }

        ResourceUri resource;
        try {
            resource = ResourceUri.parse(resourceUri);
        } catch (CapabilityException e) {
            return deny(requestId, principalId, resourceUri, DenialReason.INVALID_RESOURCE, e.getMessage());
        }

        Optional<Capability> found = reflexGuard.guarded("capability_lookup",
            () -> capabilityService.findAuthorizing(principalId, resource, action), Optional.empty());
        if (found.isEmpty()) {
            return deny(requestId, principalId, resourceUri, DenialReason.UNAUTHORIZED,
                "no active capability for action " + action);
        }
        Capability capability = found.get();

        if (opts.getSignedRequest() != null || properties.getIdentity().isRequired()) {
            ReflexResult identity = reflexGuard.wrapTimed("identity",
                () -> identityMatches(requestId, principalId, opts.getSignedRequest()));
            if (!identity.isAllowed()) {
                return deny(requestId, principalId, resourceUri, DenialReason.IDENTITY_UNVERIFIED,
                    "identity " + identity.getOutcome() + " (" + identity.getDetail() + ")");
            }
        }

        TrustCheck trust = reflexGuard.guarded("trust_tier", () -> {
            TrustTier required = trustPolicy.requiredTier(resource);
            return trustEngine.checkTier(principalId, required);
        }, TrustCheck.INSUFFICIENT);
        if (trust == TrustCheck.FROZEN) {
            return deny(requestId, principalId, resourceUri, DenialReason.TRUST_FROZEN, "agent is frozen");
        }
        if (trust != TrustCheck.OK) {
            return deny(requestId, principalId, resourceUri, DenialReason.INSUFFICIENT_TRUST,
                "tier below " + trustPolicy.requiredTier(resource));
        }

        AuthorizationRequest request = new AuthorizationRequest(requestId.toString(), principalId, resource,
            action, opts, clock.instant());

        List<ConstraintEnforcer> passed = new ArrayList<>();
        for (ConstraintEnforcer enforcer : constraintEnforcers) {
            Optional<DenialReason> violation = reflexGuard.guardedTimed(
                "constraint:" + enforcer.getClass().getSimpleName(),
                () -> enforcer.check(capability, request),
                Optional.of(DenialReason.CONSTRAINT_VIOLATED));
            if (violation.isPresent()) {
                release(passed, capability, request);
                return deny(requestId, principalId, resourceUri, violation.get(),
                    enforcer.getClass().getSimpleName() + " on " + capability.getId());
            }
            passed.add(enforcer);
        }

        EscalationDecision escalation = reflexGuard.guardedTimed("escalation",
            () -> escalationHandler.evaluate(request, capability), EscalationDecision.deny());
        if (escalation.getKind() == EscalationDecision.Kind.DENY) {
            release(passed, capability, request);
            return deny(requestId, principalId, resourceUri, DenialReason.ESCALATION_DENIED,
                "escalation handler refused");
        }

        if (opts.getCommand() != null) {
            Optional<ReflexResult> blocked = commandReflexes.firstBlocking(opts.getCommand());
            if (blocked.isPresent()) {
                release(passed, capability, request);
                return deny(requestId, principalId, resourceUri, DenialReason.REFLEX_BLOCKED,
                    "reflex " + blocked.get().getName() + " " + blocked.get().getOutcome());
            }
        }

        ReflexResult stillValid = reflexGuard.wrapTimed("capability_recheck",
            () -> capabilityService.isStillValid(capability.getId()));
        if (!stillValid.isAllowed()) {
            release(passed, capability, request);
            return deny(requestId, principalId, resourceUri, DenialReason.UNAUTHORIZED,
                "capability " + capability.getId() + " revoked or expired during check");
        }

        if (escalation.getKind() == EscalationDecision.Kind.PENDING_APPROVAL) {
            log.info("AUTHORIZATION PENDING [{}]: principal={}, capability={}, proposal={}",
                requestId, Encode.forJava(principalId), capability.getId(), escalation.getProposalId());
            auditService.record(AUDIT_CATEGORY, "authorization_pending", resourceUri, principalId,
                "proposal=" + escalation.getProposalId());
            return AuthorizationDecision.pending(escalation.getProposalId());
        }

        log.info("AUTHORIZATION GRANTED [{}]: principal={}, action={}, capability={}",
            requestId, Encode.forJava(principalId), Encode.forJava(action), capability.getId());
        auditService.record(AUDIT_CATEGORY, "authorization_granted", resourceUri, principalId,
            "capability=" + capability.getId());
        return AuthorizationDecision.authorized(capability.getId());
    }

    private boolean identityMatches(UUID requestId, String principalId, SignedRequest signedRequest) {
        if (signedRequest == null) {
            log.debug("Identity check [{}]: no signed request supplied", requestId);
            return false;
        }
        VerifiedIdentity identity;
        try {
            identity = identityVerifier.verify(signedRequest);
        } catch (IdentityVerificationException e) {
            log.debug("Identity check [{}]: {}", requestId, e.getReason());
            return false;
        }
        return identity != null && principalId.equals(identity.getAgentId());
    }

    private void release(List<ConstraintEnforcer> passed, Capability capability, AuthorizationRequest request) {
        for (ConstraintEnforcer enforcer : passed) {
            reflexGuard.guarded("release:" + enforcer.getClass().getSimpleName(), () -> {
                enforcer.release(capability, request);
                return Boolean.TRUE;
            }, Boolean.FALSE);
        }
    }

    private AuthorizationDecision deny(UUID requestId, String principalId, String resourceUri,
                                       DenialReason reason, String detail) {
        log.warn("AUTHORIZATION DENIED [{}]: {} - principal={}, resource={}, detail={}",
            requestId, reason, Encode.forJava(String.valueOf(principalId)),
            Encode.forJava(String.valueOf(resourceUri)), Encode.forJava(String.valueOf(detail)));
        auditService.record(AUDIT_CATEGORY, "authorization_denied", resourceUri, principalId,
            reason.code() + ": " + detail);
        return AuthorizationDecision.denied(reason);
    }

    /**
     * Thrown by {@link SecurityKernel#enforce} when authorization is denied.
     */
    public static class AccessDeniedException extends RuntimeException {

        private final DenialReason reason;

        public AccessDeniedException(DenialReason reason) {
            super("Access denied: " + reason.code());
            this.reason = reason;
        }

        public DenialReason getReason() {
            return reason;
        }
    }
}
