package com.arborkernel.infrastructure.security.identity;

import lombok.Value;

import java.time.Instant;

@Value
public class VerifiedIdentity {
    String agentId;
    Instant verifiedAt;
}
