package com.arborkernel.domain.repository;

import com.arborkernel.domain.model.TrustProfile;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage port for trust profiles. Writes are serialized by the trust engine.
 */
public interface TrustProfileRepository {

    void save(TrustProfile profile);

    Optional<TrustProfile> findById(String agentId);

    boolean delete(String agentId);

    Collection<TrustProfile> findAll();
}
