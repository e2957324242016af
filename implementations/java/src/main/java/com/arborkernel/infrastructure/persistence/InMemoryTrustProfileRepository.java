package com.arborkernel.infrastructure.persistence;

import com.arborkernel.domain.model.TrustProfile;
import com.arborkernel.domain.repository.TrustProfileRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryTrustProfileRepository implements TrustProfileRepository {

    private final Map<String, TrustProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public void save(TrustProfile profile) {
        profiles.put(profile.getAgentId(), profile);
    }

    @Override
    public Optional<TrustProfile> findById(String agentId) {
        return Optional.ofNullable(profiles.get(agentId));
    }

    @Override
    public boolean delete(String agentId) {
        return profiles.remove(agentId) != null;
    }

    @Override
    public Collection<TrustProfile> findAll() {
        return List.copyOf(profiles.values());
    }
}
