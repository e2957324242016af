package com.arborkernel.application;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Optional parts of a capability grant.
 *
 * <p>{@code action} defaults to the resource URI's action segment; when given it
 * must agree with it. {@code delegationDepth} defaults to the configured maximum.
 */
@Value
@Builder
public class GrantOptions {

    String action;
    Instant expiresAt;
    String signature;
    String issuerId;
    Integer delegationDepth;

    @Singular
    Map<String, String> constraints;

    public static GrantOptions none() {
        return GrantOptions.builder().build();
    }
}
