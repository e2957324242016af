package com.arborkernel.domain.repository;

import com.arborkernel.domain.model.Capability;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for capabilities.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>keep revoked capabilities as tombstones rather than deleting them</li>
 *   <li>make a saved value visible to every read that starts after {@code save} returns</li>
 *   <li>serve reads without blocking on writers</li>
 * </ul>
 *
 * <p>Callers serialize writes; implementations need not.
 */
public interface CapabilityRepository {

    /**
     * Insert or replace a capability by id.
     */
    void save(Capability capability);

    Optional<Capability> findById(String id);

    /**
     * All capabilities ever granted to a principal, tombstones included, oldest first.
     */
    List<Capability> findByPrincipal(String principalId);

    /**
     * Capabilities delegated directly from {@code parentId}, tombstones included.
     */
    List<Capability> findByParent(String parentId);

    Collection<Capability> findAll();
}
