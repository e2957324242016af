package com.arborkernel.infrastructure.security.constraint;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.domain.model.ResourceUri;
import com.arborkernel.infrastructure.security.AuthorizationOptions;
import com.arborkernel.infrastructure.security.AuthorizationRequest;
import com.arborkernel.infrastructure.security.DenialReason;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowConstraintEnforcerTest {

    private final TimeWindowConstraintEnforcer enforcer = new TimeWindowConstraintEnforcer();

    @ParameterizedTest
    @CsvSource({
        "9-17, 2025-03-01T09:00:00Z, true",
        "9-17, 2025-03-01T16:59:59Z, true",
        "9-17, 2025-03-01T17:00:00Z, false",
        "9-17, 2025-03-01T08:59:59Z, false",
        "22-6, 2025-03-01T23:30:00Z, true",
        "22-6, 2025-03-01T05:00:00Z, true",
        "22-6, 2025-03-01T12:00:00Z, false",
        "0-24, 2025-03-01T23:59:59Z, true"
    })
    void hourMustFallInRange(String hours, String at, boolean allowed) {
        Capability cap = Capability.builder()
            .id("cap_1").principalId("agent-a").resourceUri("arbor://api/call").action("call")
            .grantedAt(Instant.parse(at))
            .constraint(TimeWindowConstraintEnforcer.KEY, hours)
            .build();
        AuthorizationRequest request = new AuthorizationRequest("req", "agent-a",
            ResourceUri.parse("arbor://api/call"), "call", AuthorizationOptions.none(), Instant.parse(at));

        assertEquals(allowed, enforcer.check(cap, request).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"nine-five", "9", "25-3"})
    void unreadableRangeDenies(String hours) {
        Capability cap = Capability.builder()
            .id("cap_1").principalId("agent-a").resourceUri("arbor://api/call").action("call")
            .grantedAt(Instant.EPOCH)
            .constraint(TimeWindowConstraintEnforcer.KEY, hours)
            .build();
        AuthorizationRequest request = new AuthorizationRequest("req", "agent-a",
            ResourceUri.parse("arbor://api/call"), "call", AuthorizationOptions.none(), Instant.EPOCH);

        assertEquals(Optional.of(DenialReason.CONSTRAINT_VIOLATED), enforcer.check(cap, request));
    }
}
