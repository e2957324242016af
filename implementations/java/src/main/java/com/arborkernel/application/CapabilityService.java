package com.arborkernel.application;

import com.arborkernel.application.exceptions.CapabilityException;
import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.Capability;
import com.arborkernel.domain.model.ResourceUri;
import com.arborkernel.domain.repository.CapabilityRepository;
import com.arborkernel.infrastructure.audit.AuditService;
import com.arborkernel.infrastructure.crypto.CapabilitySigner;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Capability store: grant, revoke and lookup.
 *
 * <p><strong>Concurrency:</strong> grants and revocations are serialized by one
 * fair lock. Lookups read immutable values from the repository without locking.
 * A revocation is written before {@link #revoke} returns, so any lookup that
 * starts afterwards sees the tombstone.
 *
 * <p><strong>Matching:</strong> exact resource URI by default. With prefix
 * matching enabled a capability also covers resources beneath it, on a path
 * segment boundary only ({@code .../docs} covers {@code .../docs/a} but not
 * {@code .../docs2}).
 *
 * <p><strong>Delegation:</strong> a holder may pass a capability on while its
 * delegation depth is above zero. The child keeps the parent's resource, action
 * and constraints, expires no later than the parent and has one less depth.
 * Plain {@link #revoke} touches only the named capability;
 * {@link #cascadeRevoke} also tombstones every descendant.
 */
@Service
@Slf4j
public class CapabilityService {

    private static final String AUDIT_CATEGORY = "capability";

    private final CapabilityRepository repository;
    private final CapabilitySigner signer;
    private final AuditService auditService;
    private final Clock clock;
    private final boolean signingRequired;
    private final boolean prefixMatching;
    private final int maxDelegationDepth;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    public CapabilityService(CapabilityRepository repository,
                             CapabilitySigner signer,
                             AuditService auditService,
                             Clock clock,
                             KernelProperties properties) {
        this.repository = repository;
        this.signer = signer;
        this.auditService = auditService;
        this.clock = clock;
        this.signingRequired = properties.getCapabilities().isSigningRequired();
        this.prefixMatching = properties.getCapabilities().isPrefixMatching();
        this.maxDelegationDepth = properties.getCapabilities().getMaxDelegationDepth();
    }

    public Capability grant(String principalId, String resourceUri, GrantOptions options) {
        Objects.requireNonNull(principalId, "principalId must not be null");
        GrantOptions opts = options == null ? GrantOptions.none() : options;

        ResourceUri uri = ResourceUri.parse(resourceUri);
        String action = opts.getAction() == null ? uri.getAction() : opts.getAction();
        if (!action.equals(uri.getAction())) {
            throw CapabilityException.invalidResource(
                "action '" + Encode.forJava(action) + "' does not match " + uri.asString());
        }

        int depth = opts.getDelegationDepth() == null ? maxDelegationDepth : opts.getDelegationDepth();
        if (depth < 0 || depth > maxDelegationDepth) {
            throw CapabilityException.delegationDepthExceeded(depth, maxDelegationDepth);
        }
        boolean signed = checkSignature(principalId, uri.asString(), action, opts.getExpiresAt(), opts.getSignature());

        writeLock.lock();
        try {
            Capability capability = Capability.builder()
                .id("cap_" + UUID.randomUUID())
                .principalId(principalId)
                .resourceUri(uri.asString())
                .action(action)
                .grantedAt(now())
                .expiresAt(opts.getExpiresAt())
                .signature(signed ? opts.getSignature() : null)
                .issuerId(opts.getIssuerId())
                .delegationDepth(depth)
                .constraints(opts.getConstraints())
                .build();
            repository.save(capability);
            log.info("Granted capability {} to {} on {} ({})",
                capability.getId(), Encode.forJava(principalId), uri, action);
            auditService.record(AUDIT_CATEGORY, "capability_granted", capability.getResourceUri(), principalId,
                capability.getId());
            return capability;
        } finally {
            writeLock.unlock();
        }
    }

    public Capability grant(String principalId, String resourceUri) {
        return grant(principalId, resourceUri, GrantOptions.none());
    }

    /**
     * Pass an active capability on to another principal.
     *
     * <p>Only {@code expiresAt}, {@code signature} and extra constraints are read
     * from {@code options}. The child expires at the earlier of the requested
     * expiry and the parent's; the parent's constraints win over extras with the
     * same key.
     *
     * @throws CapabilityException {@code not_found} if the parent is unknown or inactive,
     *         {@code delegation_depth_exceeded} if it may not be delegated further
     */
    public Capability delegate(String parentCapabilityId, String recipientId, GrantOptions options) {
        Objects.requireNonNull(recipientId, "recipientId must not be null");
        GrantOptions opts = options == null ? GrantOptions.none() : options;

        writeLock.lock();
        try {
            Instant now = now();
            Capability parent = repository.findById(parentCapabilityId)
                .filter(cap -> cap.isActive(now))
                .orElseThrow(() -> CapabilityException.notFound(parentCapabilityId));
            if (parent.getDelegationDepth() <= 0) {
                log.warn("Rejected delegation of {} to {}: no delegation depth left",
                    parent.getId(), Encode.forJava(recipientId));
                throw CapabilityException.delegationDepthExceeded(parent.getDelegationDepth() - 1, maxDelegationDepth);
            }

            Instant expiresAt = earliest(parent.getExpiresAt(), opts.getExpiresAt());
            boolean signed = checkSignature(recipientId, parent.getResourceUri(), parent.getAction(), expiresAt,
                opts.getSignature());
            Map<String, String> constraints = new HashMap<>(opts.getConstraints());
            constraints.putAll(parent.getConstraints());

            Capability child = Capability.builder()
                .id("cap_" + UUID.randomUUID())
                .principalId(recipientId)
                .resourceUri(parent.getResourceUri())
                .action(parent.getAction())
                .grantedAt(now)
                .expiresAt(expiresAt)
                .signature(signed ? opts.getSignature() : null)
                .issuerId(parent.getPrincipalId())
                .parentCapabilityId(parent.getId())
                .delegationDepth(parent.getDelegationDepth() - 1)
                .constraints(constraints)
                .build();
            repository.save(child);
            log.info("Delegated capability {} from {} to {} as {}", parent.getId(),
                Encode.forJava(parent.getPrincipalId()), Encode.forJava(recipientId), child.getId());
            auditService.record(AUDIT_CATEGORY, "capability_delegated", child.getResourceUri(), recipientId,
                parent.getId() + "->" + child.getId());
            return child;
        } finally {
            writeLock.unlock();
        }
    }

    public Capability delegate(String parentCapabilityId, String recipientId) {
        return delegate(parentCapabilityId, recipientId, GrantOptions.none());
    }

    /**
     * Tombstone a capability.
     *
     * @throws CapabilityException {@code not_found} if unknown or already revoked
     */
    public void revoke(String capabilityId) {
        writeLock.lock();
        try {
            Capability current = repository.findById(capabilityId)
                .filter(cap -> !cap.isRevoked())
                .orElseThrow(() -> CapabilityException.notFound(capabilityId));
            repository.save(current.revoke(now()));
            log.info("Revoked capability {} of {}", capabilityId, Encode.forJava(current.getPrincipalId()));
            auditService.record(AUDIT_CATEGORY, "capability_revoked", current.getResourceUri(),
                current.getPrincipalId(), capabilityId);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Tombstone a capability and everything delegated from it, directly or
     * transitively. Members of the tree that are already revoked are skipped but
     * still searched for live descendants.
     *
     * @return number of capabilities newly revoked
     * @throws CapabilityException {@code not_found} if the capability is unknown
     */
    public int cascadeRevoke(String capabilityId) {
        writeLock.lock();
        try {
            Capability root = repository.findById(capabilityId)
                .orElseThrow(() -> CapabilityException.notFound(capabilityId));
            Instant now = now();
            int count = 0;
            Deque<Capability> pending = new ArrayDeque<>();
            Set<String> seen = new HashSet<>();
            pending.add(root);
            while (!pending.isEmpty()) {
                Capability cap = pending.poll();
                if (!seen.add(cap.getId())) {
                    continue;
                }
                if (!cap.isRevoked()) {
                    repository.save(cap.revoke(now));
                    count++;
                }
                pending.addAll(repository.findByParent(cap.getId()));
            }
            log.info("Cascade revoked {} capabilities from {}", count, capabilityId);
            auditService.record(AUDIT_CATEGORY, "capabilities_cascade_revoked", root.getResourceUri(),
                root.getPrincipalId(), capabilityId + ":" + count);
            return count;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Tombstone every unrevoked capability of a principal.
     *
     * @return number of capabilities revoked
     */
    public int revokeAll(String principalId) {
        writeLock.lock();
        try {
            Instant now = now();
            int count = 0;
            for (Capability cap : repository.findByPrincipal(principalId)) {
                if (!cap.isRevoked()) {
                    repository.save(cap.revoke(now));
                    count++;
                }
            }
            if (count > 0) {
                log.info("Revoked {} capabilities of {}", count, Encode.forJava(principalId));
                auditService.record(AUDIT_CATEGORY, "capabilities_revoked", null, principalId,
                    String.valueOf(count));
            }
            return count;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Active capabilities of a principal, oldest grant first.
     */
    public List<Capability> list(String principalId) {
        return list(principalId, false);
    }

    public List<Capability> list(String principalId, boolean includeInactive) {
        List<Capability> all = repository.findByPrincipal(principalId);
        if (includeInactive) {
            return all;
        }
        Instant now = now();
        return all.stream().filter(cap -> cap.isActive(now)).collect(Collectors.toList());
    }

    public Capability get(String capabilityId) {
        return repository.findById(capabilityId).orElseThrow(() -> CapabilityException.notFound(capabilityId));
    }

    /**
     * Narrow capability check.
     *
     * <p>Answers only "does an active, valid capability exist"; it does not
     * verify identity, trust tier, constraints, escalation or reflexes. Use
     * the security kernel to authorize an operation. Every call is logged with
     * the {@code NARROW_CHECK} marker so call sites remain auditable.
     */
    public boolean exists(String principalId, String resourceUri, String action) {
        if (!ResourceUri.isValid(resourceUri)) {
            log.debug("NARROW_CHECK principal={} resource=<invalid> action={} result=false",
                Encode.forJava(String.valueOf(principalId)), Encode.forJava(String.valueOf(action)));
            return false;
        }
        boolean found = findAuthorizing(principalId, ResourceUri.parse(resourceUri), action).isPresent();
        log.debug("NARROW_CHECK principal={} resource={} action={} result={}",
            Encode.forJava(String.valueOf(principalId)), resourceUri, Encode.forJava(String.valueOf(action)), found);
        return found;
    }

    /**
     * The oldest capability that currently authorizes the action, if any.
     */
    public Optional<Capability> findAuthorizing(String principalId, ResourceUri resource, String action) {
        Instant now = now();
        for (Capability cap : repository.findByPrincipal(principalId)) {
            if (authorizes(cap, resource, action, now)) {
                return Optional.of(cap);
            }
        }
        return Optional.empty();
    }

    /**
     * Re-read a capability and confirm it is still usable.
     */
    public boolean isStillValid(String capabilityId) {
        return repository.findById(capabilityId)
            .map(cap -> cap.isActive(now()) && signatureAcceptable(cap))
            .orElse(false);
    }

    /**
     * Tombstone capabilities whose expiry has passed.
     *
     * @return number of capabilities tombstoned
     */
    public int purgeExpired() {
        writeLock.lock();
        try {
            Instant now = now();
            int count = 0;
            for (Capability cap : repository.findAll()) {
                if (!cap.isRevoked() && cap.isExpired(now)) {
                    repository.save(cap.revoke(now));
                    count++;
                }
            }
            if (count > 0) {
                log.info("Purged {} expired capabilities", count);
            }
            return count;
        } finally {
            writeLock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${arbor.kernel.capabilities.cleanup-interval:PT1M}",
        initialDelayString = "${arbor.kernel.capabilities.cleanup-interval:PT1M}")
    void scheduledPurge() {
        purgeExpired();
    }

    public CapabilityStats stats() {
        Collection<Capability> all = repository.findAll();
        Instant now = now();
        long revoked = all.stream().filter(Capability::isRevoked).count();
        long expired = all.stream().filter(cap -> !cap.isRevoked() && cap.isExpired(now)).count();
        long active = all.stream().filter(cap -> cap.isActive(now)).count();
        return new CapabilityStats(all.size(), active, revoked, expired);
    }

    /**
     * @return whether the grant carries a signature, after verifying it
     */
    private boolean checkSignature(String principalId, String resourceUri, String action, Instant expiresAt,
                                   String signature) {
        boolean signed = signature != null && !signature.isBlank();
        if (signingRequired && !signed) {
            log.warn("Rejected unsigned grant to {} on {}", Encode.forJava(principalId), resourceUri);
            throw CapabilityException.signatureRequired();
        }
        if (signed) {
            String payload = Capability.signingPayload(principalId, resourceUri, action, expiresAt);
            if (!signer.verify(payload, signature)) {
                log.warn("Rejected grant to {} on {}: signature does not verify",
                    Encode.forJava(principalId), resourceUri);
                throw CapabilityException.signatureRequired();
            }
        }
        return signed;
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    private boolean authorizes(Capability cap, ResourceUri resource, String action, Instant now) {
        if (!cap.isActive(now) || !cap.getAction().equals(action)) {
            return false;
        }
        if (!matches(cap.getResourceUri(), resource)) {
            return false;
        }
        return signatureAcceptable(cap);
    }

    private boolean matches(String granted, ResourceUri requested) {
        if (granted.equals(requested.asString())) {
            return true;
        }
        return prefixMatching && ResourceUri.parse(granted).covers(requested);
    }

    private boolean signatureAcceptable(Capability cap) {
        if (!cap.isSigned()) {
            return !signingRequired;
        }
        return signer.verify(cap.signingPayload(), cap.getSignature());
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
