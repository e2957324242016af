package com.arborkernel.infrastructure.security;

import com.arborkernel.infrastructure.security.identity.SignedRequest;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Optional inputs to an authorization.
 *
 * <ul>
 *   <li>{@code signedRequest}: proves the principal's identity; verified when present</li>
 *   <li>{@code command}: shell command the caller is about to run; screened by the command reflexes</li>
 *   <li>{@code traceId}: caller correlation id echoed into logs and audit records</li>
 *   <li>{@code context}: free-form attributes for escalation and constraint collaborators</li>
 * </ul>
 */
@Value
@Builder
public class AuthorizationOptions {

    SignedRequest signedRequest;
    String command;
    String traceId;

    @Singular("context")
    Map<String, String> context;

    public static AuthorizationOptions none() {
        return AuthorizationOptions.builder().build();
    }
}
