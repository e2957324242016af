package com.arborkernel.application.trust;

import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.TrustEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent behavioral events per agent, newest kept.
 *
 * <p>Each agent's history is capped; appending past the cap drops the oldest
 * event.
 */
@Component
public class TrustEventLog {

    private final int capacity;
    private final Map<String, Deque<TrustEvent>> byAgent = new ConcurrentHashMap<>();

    public TrustEventLog(KernelProperties properties) {
        this.capacity = properties.getTrust().getEventHistorySize();
    }

    public void append(TrustEvent event) {
        Deque<TrustEvent> history = byAgent.computeIfAbsent(event.getAgentId(), id -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(event);
            while (history.size() > capacity) {
                history.pollFirst();
            }
        }
    }

    /**
     * Up to {@code limit} most recent events for an agent, newest first.
     */
    public List<TrustEvent> recent(String agentId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        Deque<TrustEvent> history = byAgent.get(agentId);
        if (history == null) {
            return List.of();
        }
        List<TrustEvent> result = new ArrayList<>(Math.min(limit, capacity));
        synchronized (history) {
            Iterator<TrustEvent> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
        }
        return List.copyOf(result);
    }

    public void clear(String agentId) {
        byAgent.remove(agentId);
    }
}
