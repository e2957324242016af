package com.arborkernel.application;

import lombok.Value;

/**
 * Point-in-time counters over the capability store.
 */
@Value
public class CapabilityStats {
    long granted;
    long active;
    long revoked;
    long expired;
}
