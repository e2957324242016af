package com.arborkernel.infrastructure.security;

import com.arborkernel.domain.model.ResourceUri;
import lombok.Value;

import java.time.Instant;

/**
 * A parsed authorization request as seen by constraint and escalation collaborators.
 */
@Value
public class AuthorizationRequest {
    String requestId;
    String principalId;
    ResourceUri resource;
    String action;
    AuthorizationOptions options;
    Instant requestedAt;
}
