package com.arborkernel.application.trust;

import lombok.Value;

@Value
public class TrustSummary {
    long profiles;
    long frozen;
}
