package com.arborkernel.config;

import com.arborkernel.domain.model.TrustTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Kernel configuration bound from {@code arbor.kernel.*}.
 *
 * <p>Every field has a safe default so the kernel can be built without a
 * Spring context (tests construct it directly).
 */
@ConfigurationProperties(prefix = "arbor.kernel")
@Validated
@Getter
@Setter
public class KernelProperties {

    @Valid
    private Capabilities capabilities = new Capabilities();

    @Valid
    private Identity identity = new Identity();

    @Valid
    private Trust trust = new Trust();

    @Valid
    private Reflex reflex = new Reflex();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Sanitizers sanitizers = new Sanitizers();

    @Getter
    @Setter
    public static class Capabilities {
        /** Period of the sweep that tombstones expired capabilities. */
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(1);

        /** Refuse unsigned grants and ignore unsigned capabilities at check time. */
        private boolean signingRequired = false;

        /** Base64 HMAC key; blank generates an ephemeral key. */
        private String signingKey = "";

        /**
         * Let a capability cover every resource beneath its URI. Off by default:
         * it silently widens grants to sibling resources.
         */
        private boolean prefixMatching = false;

        /** Upper bound, and default, for how many times a grant may be re-delegated. */
        @Min(0)
        private int maxDelegationDepth = 3;
    }

    @Getter
    @Setter
    public static class Identity {
        /** Deny any authorization that does not carry a verified signed request. */
        private boolean required = false;

        @NotNull
        private Duration maxClockSkew = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Trust {
        @Valid
        private Weights weights = new Weights();

        /** Minimum score tier per resource prefix; the longest matching prefix wins. */
        @Valid
        private List<TierRule> tierPolicy = new ArrayList<>();

        @NotNull
        private TrustTier defaultRequiredTier = TrustTier.UNTRUSTED;

        /** Period of the inactivity decay sweep. */
        @NotNull
        private Duration decayInterval = Duration.ofHours(1);

        @Valid
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        /** Behavioral events kept per agent for {@code getEvents}; older ones are dropped. */
        @Min(1)
        private int eventHistorySize = 100;
    }

    @Getter
    @Setter
    public static class Weights {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double successRate = 0.30;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double uptime = 0.15;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double security = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double testPass = 0.20;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double rollback = 0.10;

        @AssertTrue(message = "trust weights must sum to 1.0")
        public boolean isNormalized() {
            return Math.abs(successRate + uptime + security + testPass + rollback - 1.0) < 1e-9;
        }
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierRule {
        @NotBlank
        private String prefix;
        @NotNull
        private TrustTier tier;
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private boolean enabled = true;

        @Valid
        private Threshold actionFailure = new Threshold(5, Duration.ofSeconds(60));
        @Valid
        private Threshold securityViolation = new Threshold(3, Duration.ofHours(1));
        @Valid
        private Threshold rollbackExecuted = new Threshold(3, Duration.ofHours(1));
        @Valid
        private Threshold testFailed = new Threshold(5, Duration.ofMinutes(5));
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Threshold {
        @Min(1)
        private int count;
        @NotNull
        private Duration window;
    }

    @Getter
    @Setter
    public static class Reflex {
        /** Upper bound for timed reflex checks; expiry denies. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class RateLimit {
        @NotNull
        private Duration window = Duration.ofMinutes(1);

        @Min(1)
        private long maxTrackedKeys = 10_000;
    }

    @Getter
    @Setter
    public static class Sanitizers {
        @NotEmpty
        private List<String> allowedSchemes = new ArrayList<>(List.of("http", "https"));

        @NotEmpty
        private List<Integer> allowedPorts = new ArrayList<>(List.of(80, 443));

        @NotNull
        private Duration resolveTimeout = Duration.ofSeconds(2);

        @Min(1)
        private int maxDepth = 32;

        @Min(1)
        private int maxSize = 10_000;

        @Min(1)
        private int maxByteSize = 1_048_576;

        @Min(1)
        private int maxLogLength = 10_000;

        @Min(1)
        private int promptFailThreshold = 2;

        /**
         * Class names or {@code package.*} patterns accepted by binary deserialization.
         * {@code Object} and {@code Map$Entry} cover the backing arrays collections allocate on read.
         */
        @NotEmpty
        private List<String> deserializationAllowlist = new ArrayList<>(List.of(
            "java.lang.Object",
            "java.util.Map$Entry",
            "java.lang.String",
            "java.lang.Number",
            "java.lang.Integer",
            "java.lang.Long",
            "java.lang.Double",
            "java.lang.Boolean",
            "java.util.ArrayList",
            "java.util.HashMap",
            "java.util.LinkedHashMap",
            "java.util.HashSet"
        ));
    }
}
