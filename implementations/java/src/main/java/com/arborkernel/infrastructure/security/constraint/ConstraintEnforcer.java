package com.arborkernel.infrastructure.security.constraint;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.infrastructure.security.AuthorizationRequest;
import com.arborkernel.infrastructure.security.DenialReason;

import java.util.Optional;

/**
 * Checks one kind of per-capability constraint.
 *
 * <p>Enforcers ignore capabilities that do not carry their constraint key. A
 * constraint value the enforcer cannot interpret denies.
 */
public interface ConstraintEnforcer {

    /**
     * @return a denial reason, or empty when the request satisfies the constraint
     */
    Optional<DenialReason> check(Capability capability, AuthorizationRequest request);

    /**
     * Undo what a passing {@link #check} recorded, for a request a later step denied.
     */
    default void release(Capability capability, AuthorizationRequest request) {
    }
}
