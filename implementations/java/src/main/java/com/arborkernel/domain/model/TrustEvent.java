package com.arborkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One behavioral event as applied to an agent's profile, with the score and
 * tier on either side of it.
 */
@Value
@Builder
public class TrustEvent {

    String agentId;
    TrustEventType type;
    Instant occurredAt;
    int scoreBefore;
    int scoreAfter;
    TrustTier tierBefore;
    TrustTier tierAfter;
    Map<String, String> metadata;
}
