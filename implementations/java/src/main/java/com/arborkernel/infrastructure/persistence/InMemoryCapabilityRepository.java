package com.arborkernel.infrastructure.persistence;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.domain.repository.CapabilityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory capability storage indexed by id, by principal and by parent.
 *
 * <p>Values are immutable and the secondary indexes are replaced, never
 * mutated, so readers always see a consistent snapshot without locking.
 */
@Repository
@Slf4j
public class InMemoryCapabilityRepository implements CapabilityRepository {

    private static final Comparator<Capability> BY_GRANT_TIME =
        Comparator.comparing(Capability::getGrantedAt).thenComparing(Capability::getId);

    private final Map<String, Capability> byId = new ConcurrentHashMap<>();
    private final Map<String, List<String>> byPrincipal = new ConcurrentHashMap<>();
    private final Map<String, List<String>> byParent = new ConcurrentHashMap<>();

    @Override
    public void save(Capability capability) {
        Capability previous = byId.put(capability.getId(), capability);
        if (previous == null) {
            byPrincipal.compute(capability.getPrincipalId(), (principal, ids) -> append(ids, capability.getId()));
            if (capability.getParentCapabilityId() != null) {
                byParent.compute(capability.getParentCapabilityId(), (parent, ids) -> append(ids, capability.getId()));
            }
        }
        log.trace("Stored capability {} (replaced={})", capability.getId(), previous != null);
    }

    @Override
    public Optional<Capability> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<Capability> findByPrincipal(String principalId) {
        return resolve(byPrincipal.getOrDefault(principalId, List.of()));
    }

    @Override
    public List<Capability> findByParent(String parentId) {
        return resolve(byParent.getOrDefault(parentId, List.of()));
    }

    @Override
    public Collection<Capability> findAll() {
        return List.copyOf(byId.values());
    }

    private static List<String> append(List<String> ids, String id) {
        List<String> next = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
        next.add(id);
        return List.copyOf(next);
    }

    private List<Capability> resolve(List<String> ids) {
        List<Capability> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Capability cap = byId.get(id);
            if (cap != null) {
                result.add(cap);
            }
        }
        result.sort(BY_GRANT_TIME);
        return result;
    }
}
