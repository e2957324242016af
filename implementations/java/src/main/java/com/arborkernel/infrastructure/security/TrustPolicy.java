package com.arborkernel.infrastructure.security;

import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.ResourceUri;
import com.arborkernel.domain.model.TrustTier;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Minimum score tier per resource.
 *
 * <p>Rules are resource-URI prefixes matched on a segment boundary; the longest
 * matching prefix wins, otherwise the default tier applies.
 */
public class TrustPolicy {

    private final List<KernelProperties.TierRule> rules;
    private final TrustTier defaultTier;

    public TrustPolicy(List<KernelProperties.TierRule> rules, TrustTier defaultTier) {
        this.rules = rules.stream()
            .sorted(Comparator.comparingInt((KernelProperties.TierRule r) -> r.getPrefix().length()).reversed())
            .collect(Collectors.toUnmodifiableList());
        this.defaultTier = defaultTier;
    }

    public static TrustPolicy from(KernelProperties properties) {
        return new TrustPolicy(properties.getTrust().getTierPolicy(), properties.getTrust().getDefaultRequiredTier());
    }

    public TrustTier requiredTier(ResourceUri resource) {
        String uri = resource.asString();
        for (KernelProperties.TierRule rule : rules) {
            String prefix = rule.getPrefix();
            if (uri.equals(prefix) || uri.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return rule.getTier();
            }
        }
        return defaultTier;
    }
}
