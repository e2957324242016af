package com.arborkernel.infrastructure.security.constraint;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.infrastructure.security.AuthorizationRequest;
import com.arborkernel.infrastructure.security.DenialReason;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enforces {@code allowed_hours}, e.g. {@code 9-17}: the request's UTC hour must
 * fall in {@code [start, end)}. A range with start after end wraps midnight.
 */
@Slf4j
public class TimeWindowConstraintEnforcer implements ConstraintEnforcer {

    public static final String KEY = "allowed_hours";

    private static final Pattern RANGE = Pattern.compile("\\s*(\\d{1,2})\\s*-\\s*(\\d{1,2})\\s*");

    @Override
    public Optional<DenialReason> check(Capability capability, AuthorizationRequest request) {
        String raw = capability.getConstraints().get(KEY);
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = RANGE.matcher(raw);
        if (!m.matches()) {
            log.warn("Capability {} has unreadable allowed_hours '{}'", capability.getId(), raw);
            return Optional.of(DenialReason.CONSTRAINT_VIOLATED);
        }
        int start = Integer.parseInt(m.group(1));
        int end = Integer.parseInt(m.group(2));
        if (start > 24 || end > 24) {
            return Optional.of(DenialReason.CONSTRAINT_VIOLATED);
        }
        int hour = request.getRequestedAt().atOffset(ZoneOffset.UTC).getHour();
        boolean inside = start <= end
            ? hour >= start && hour < end
            : hour >= start || hour < end;
        return inside ? Optional.empty() : Optional.of(DenialReason.CONSTRAINT_VIOLATED);
    }
}
