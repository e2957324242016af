package com.arborkernel.infrastructure.security;

import com.arborkernel.application.CapabilityService;
import com.arborkernel.application.GrantOptions;
import com.arborkernel.application.trust.CircuitBreaker;
import com.arborkernel.application.trust.TrustEngine;
import com.arborkernel.application.trust.TrustEventLog;
import com.arborkernel.application.trust.TrustScoreCalculator;
import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.Capability;
import com.arborkernel.domain.model.TrustEventType;
import com.arborkernel.domain.model.TrustTier;
import com.arborkernel.infrastructure.crypto.HmacCapabilitySigner;
import com.arborkernel.infrastructure.persistence.InMemoryCapabilityRepository;
import com.arborkernel.infrastructure.persistence.InMemoryTrustProfileRepository;
import com.arborkernel.infrastructure.security.constraint.ConstraintEnforcer;
import com.arborkernel.infrastructure.security.constraint.RateLimitConstraintEnforcer;
import com.arborkernel.infrastructure.security.constraint.TimeWindowConstraintEnforcer;
import com.arborkernel.infrastructure.security.escalation.DefaultEscalationHandler;
import com.arborkernel.infrastructure.security.escalation.EscalationDecision;
import com.arborkernel.infrastructure.security.escalation.EscalationHandler;
import com.arborkernel.infrastructure.security.identity.HmacIdentityVerifier;
import com.arborkernel.infrastructure.security.identity.IdentityVerifier;
import com.arborkernel.infrastructure.security.identity.SignedRequest;
import com.arborkernel.infrastructure.security.reflex.CommandReflexes;
import com.arborkernel.infrastructure.security.reflex.ReflexGuard;
import com.arborkernel.support.MutableClock;
import com.arborkernel.support.RecordingAuditService;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TrustedSecurityKernelTest {

    private static final String DOCS = "arbor://fs/read/docs";
    private static final String SHELL = "arbor://shell/exec";

    private MutableClock clock;
    private RecordingAuditService audit;
    private KernelProperties properties;
    private CapabilityService capabilities;
    private TrustEngine trust;
    private HmacIdentityVerifier identityVerifier;
    private IdentityVerifier identity;
    private List<ConstraintEnforcer> enforcers;
    private EscalationHandler escalation;
    private ReflexGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        audit = new RecordingAuditService();
        properties = new KernelProperties();
        properties.getTrust().getTierPolicy().add(new KernelProperties.TierRule(SHELL, TrustTier.TRUSTED));
        capabilities = new CapabilityService(new InMemoryCapabilityRepository(),
            new HmacCapabilitySigner("kernel-test-capability-key-0123".getBytes(StandardCharsets.UTF_8)),
            audit, clock, properties);
        trust = new TrustEngine(new InMemoryTrustProfileRepository(), new TrustScoreCalculator(properties),
            new CircuitBreaker(properties), new TrustEventLog(properties), audit, clock);
        identityVerifier = new HmacIdentityVerifier(Duration.ofMinutes(5), clock);
        identityVerifier.register("agent-a", "agent-a-identity-key-0123456789".getBytes(StandardCharsets.UTF_8));
        identityVerifier.register("agent-b", "agent-b-identity-key-0123456789".getBytes(StandardCharsets.UTF_8));
        identity = identityVerifier;
        enforcers = new ArrayList<>(List.of(
            new RateLimitConstraintEnforcer(Caffeine.newBuilder().build(), Duration.ofMinutes(1)),
            new TimeWindowConstraintEnforcer()));
        escalation = new DefaultEscalationHandler();
        guard = new ReflexGuard(new TaskExecutorAdapter(new SyncTaskExecutor()), Duration.ofSeconds(1));
    }

    private SecurityKernel kernel() {
        return new TrustedSecurityKernel(capabilities, trust, TrustPolicy.from(properties), identity, enforcers,
            escalation, new CommandReflexes(guard), guard, audit, properties, clock);
    }

    @Test
    void grantedCapabilityAuthorizesUntilRevoked() {
        Capability cap = capabilities.grant("agent-a", DOCS);

        AuthorizationDecision granted = kernel().authorize("agent-a", DOCS, "read");
        assertTrue(granted.isAuthorized());
        assertEquals(cap.getId(), granted.getCapabilityId());

        capabilities.revoke(cap.getId());

        AuthorizationDecision denied = kernel().authorize("agent-a", DOCS, "read");
        assertTrue(denied.isDenied());
        assertEquals(DenialReason.UNAUTHORIZED, denied.getReason());
        assertEquals(List.of("capability=" + cap.getId()), audit.detailsFor("authorization_granted"));
    }

    @Test
    void frozenAgentIsDeniedDespiteCapability() {
        capabilities.grant("agent-a", DOCS);
        trust.createProfile("agent-a");
        trust.freeze("agent-a", "anomaly_detected");

        assertEquals(DenialReason.TRUST_FROZEN, kernel().authorize("agent-a", DOCS, "read").getReason());
        assertEquals(1, capabilities.list("agent-a").size());
    }

    @Test
    void malformedInputsAreDenied() {
        assertEquals(DenialReason.INVALID_RESOURCE, kernel().authorize("agent-a", "fs/read", "read").getReason());
        assertEquals(DenialReason.INVALID_RESOURCE,
            kernel().authorize("agent-a", "arbor://fs/read/../etc", "read").getReason());
        assertEquals(DenialReason.UNAUTHORIZED, kernel().authorize(" ", DOCS, "read").getReason());
        assertEquals(DenialReason.UNAUTHORIZED, kernel().authorize("agent-a", DOCS, null).getReason());
    }

    @Test
    void missingCapabilityIsUnauthorizedAndAudited() {
        AuthorizationDecision decision = kernel().authorize("agent-a", DOCS, "read");

        assertEquals(DenialReason.UNAUTHORIZED, decision.getReason());
        assertTrue(audit.detailsFor("authorization_denied").get(0).startsWith("unauthorized: "));
    }

    @Test
    void expiredCapabilityNoLongerAuthorizes() {
        capabilities.grant("agent-a", DOCS,
            GrantOptions.builder().expiresAt(clock.instant().plus(Duration.ofMinutes(5))).build());
        assertTrue(kernel().authorize("agent-a", DOCS, "read").isAuthorized());

        clock.advance(Duration.ofMinutes(6));

        assertEquals(DenialReason.UNAUTHORIZED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void resourcePolicyRequiresTier() {
        capabilities.grant("agent-a", SHELL);

        assertEquals(DenialReason.INSUFFICIENT_TRUST, kernel().authorize("agent-a", SHELL, "exec").getReason());

        trust.recordEvent("agent-a", TrustEventType.ACTION_SUCCESS);

        assertTrue(kernel().authorize("agent-a", SHELL, "exec").isAuthorized());
    }

    @Test
    void signedRequestMustMatchPrincipal() {
        capabilities.grant("agent-a", DOCS);
        SignedRequest own = identityVerifier.sign("agent-a", "read docs");
        SignedRequest other = identityVerifier.sign("agent-b", "read docs");

        assertTrue(kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().signedRequest(own).build()).isAuthorized());
        assertEquals(DenialReason.IDENTITY_UNVERIFIED, kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().signedRequest(other).build()).getReason());

        SignedRequest forged = new SignedRequest("agent-a", "read docs", own.getTimestamp(), other.getSignature());
        assertEquals(DenialReason.IDENTITY_UNVERIFIED, kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().signedRequest(forged).build()).getReason());
    }

    @Test
    void requiredIdentityDeniesUnsignedRequests() {
        properties.getIdentity().setRequired(true);
        capabilities.grant("agent-a", DOCS);

        assertEquals(DenialReason.IDENTITY_UNVERIFIED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void crashingIdentityVerifierDenies() {
        capabilities.grant("agent-a", DOCS);
        identity = request -> {
            throw new IllegalStateException("key store offline");
        };

        AuthorizationDecision decision = kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().signedRequest(identityVerifier.sign("agent-a", "x")).build());

        assertEquals(DenialReason.IDENTITY_UNVERIFIED, decision.getReason());
    }

    @Test
    void rateLimitConstraintApplies() {
        capabilities.grant("agent-a", DOCS, GrantOptions.builder().constraint("rate_limit", "2").build());

        assertTrue(kernel().authorize("agent-a", DOCS, "read").isAuthorized());
        SecurityKernel kernel = kernel();
        assertTrue(kernel.authorize("agent-a", DOCS, "read").isAuthorized());
        assertEquals(DenialReason.RATE_LIMITED, kernel.authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void timeWindowConstraintApplies() {
        capabilities.grant("agent-a", DOCS, GrantOptions.builder().constraint("allowed_hours", "9-17").build());

        assertTrue(kernel().authorize("agent-a", DOCS, "read").isAuthorized());
        clock.set(Instant.parse("2025-03-01T20:00:00Z"));
        assertEquals(DenialReason.CONSTRAINT_VIOLATED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void crashingConstraintEnforcerDenies() {
        capabilities.grant("agent-a", DOCS);
        enforcers.add((capability, request) -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(DenialReason.CONSTRAINT_VIOLATED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void escalationCanDeferToApproval() {
        Capability cap = capabilities.grant("agent-a", DOCS);
        escalation = (request, capability) -> EscalationDecision.pendingApproval("prop-" + capability.getId());

        AuthorizationDecision decision = kernel().authorize("agent-a", DOCS, "read");

        assertTrue(decision.isPending());
        assertEquals("prop-" + cap.getId(), decision.getProposalId());
        ApprovalPendingException pending = assertThrows(ApprovalPendingException.class,
            () -> kernel().enforce("agent-a", DOCS, "read"));
        assertEquals("prop-" + cap.getId(), pending.getProposalId());
        assertEquals(2, audit.count("authorization_pending"));
    }

    @Test
    void escalationDenialAndCrashBothDeny() {
        capabilities.grant("agent-a", DOCS);

        escalation = (request, capability) -> EscalationDecision.deny();
        assertEquals(DenialReason.ESCALATION_DENIED, kernel().authorize("agent-a", DOCS, "read").getReason());

        escalation = (request, capability) -> {
            throw new IllegalStateException("approval service down");
        };
        assertEquals(DenialReason.ESCALATION_DENIED, kernel().authorize("agent-a", DOCS, "read").getReason());

        escalation = (request, capability) -> null;
        assertEquals(DenialReason.ESCALATION_DENIED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void escalationSeesParsedRequest() {
        capabilities.grant("agent-a", DOCS);
        List<AuthorizationRequest> seen = new ArrayList<>();
        escalation = (request, capability) -> {
            seen.add(request);
            return EscalationDecision.proceed();
        };

        kernel().authorize("agent-a", DOCS, "read", AuthorizationOptions.builder()
            .traceId("trace-1").context("ticket", "OPS-7").build());

        AuthorizationRequest request = seen.get(0);
        assertEquals("docs", request.getResource().getPath().get(0));
        assertEquals(clock.instant(), request.getRequestedAt());
        assertEquals("OPS-7", request.getOptions().getContext().get("ticket"));
    }

    @Test
    void commandReflexesScreenCommands() {
        capabilities.grant("agent-a", DOCS);

        assertEquals(DenialReason.REFLEX_BLOCKED, kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().command("sudo cat /etc/shadow").build()).getReason());
        assertTrue(kernel().authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().command("cat docs/readme.md").build()).isAuthorized());
    }

    @Test
    void revocationDuringCheckIsHonoured() {
        capabilities.grant("agent-a", DOCS);
        escalation = (request, capability) -> {
            capabilities.revoke(capability.getId());
            return EscalationDecision.proceed();
        };

        assertEquals(DenialReason.UNAUTHORIZED, kernel().authorize("agent-a", DOCS, "read").getReason());
    }

    @Test
    void enforceReturnsCapabilityOrThrows() {
        Capability cap = capabilities.grant("agent-a", DOCS);

        assertEquals(cap.getId(), kernel().enforce("agent-a", DOCS, "read"));
        TrustedSecurityKernel.AccessDeniedException denied = assertThrows(
            TrustedSecurityKernel.AccessDeniedException.class, () -> kernel().enforce("agent-b", DOCS, "read"));
        assertEquals(DenialReason.UNAUTHORIZED, denied.getReason());
    }

    @Test
    void stalledCollaboratorsDenyWithinReflexTimeout() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("kernel-test-");
        executor.initialize();
        try {
            guard = new ReflexGuard(executor, Duration.ofMillis(200));
            capabilities.grant("agent-a", DOCS);
            escalation = (request, capability) -> {
                stall();
                return EscalationDecision.proceed();
            };

            long started = System.nanoTime();
            AuthorizationDecision decision = kernel().authorize("agent-a", DOCS, "read");

            assertEquals(DenialReason.ESCALATION_DENIED, decision.getReason());
            assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);

            escalation = new DefaultEscalationHandler();
            identity = request -> {
                stall();
                return identityVerifier.verify(request);
            };
            assertEquals(DenialReason.IDENTITY_UNVERIFIED, kernel().authorize("agent-a", DOCS, "read",
                AuthorizationOptions.builder().signedRequest(identityVerifier.sign("agent-a", "x")).build())
                .getReason());

            identity = identityVerifier;
            enforcers.add((capability, request) -> {
                stall();
                return Optional.empty();
            });
            assertEquals(DenialReason.CONSTRAINT_VIOLATED, kernel().authorize("agent-a", DOCS, "read").getReason());
        } finally {
            executor.shutdown();
        }
    }

    private static void stall() {
        try {
            Thread.sleep(3_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    @Test
    void deniedRequestsGiveBackRateLimitSlot() {
        capabilities.grant("agent-a", DOCS, GrantOptions.builder().constraint("rate_limit", "1").build());
        SecurityKernel kernel = kernel();

        assertEquals(DenialReason.REFLEX_BLOCKED, kernel.authorize("agent-a", DOCS, "read",
            AuthorizationOptions.builder().command("sudo rm -rf /").build()).getReason());
        assertTrue(kernel.authorize("agent-a", DOCS, "read").isAuthorized());
        assertEquals(DenialReason.RATE_LIMITED, kernel.authorize("agent-a", DOCS, "read").getReason());
    }
}
