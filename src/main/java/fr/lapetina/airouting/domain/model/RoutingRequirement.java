package fr.lapetina.airouting.domain.model;

import java.util.Set;

/**
 * Optional hard constraints a caller attaches to a routing request.
 * A {@code null} limit means the caller does not care about that dimension.
 */
public record RoutingRequirement(
        Double maxResponseTimeMs,
        Double qualityThreshold,
        Double reliabilityRequirement,
        Set<String> preferredProviders,
        Urgency urgency
) {
    public RoutingRequirement {
        preferredProviders = preferredProviders != null ? Set.copyOf(preferredProviders) : Set.of();
        if (urgency == null) {
            urgency = Urgency.MEDIUM;
        }
    }

    public static RoutingRequirement none() {
        return new RoutingRequirement(null, null, null, null, null);
    }

    public boolean isPreferred(String providerId) {
        return preferredProviders.contains(providerId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double maxResponseTimeMs;
        private Double qualityThreshold;
        private Double reliabilityRequirement;
        private Set<String> preferredProviders = Set.of();
        private Urgency urgency = Urgency.MEDIUM;

        public Builder maxResponseTimeMs(double ms) {
            this.maxResponseTimeMs = ms;
            return this;
        }

        public Builder qualityThreshold(double threshold) {
            this.qualityThreshold = threshold;
            return this;
        }

        public Builder reliabilityRequirement(double requirement) {
            this.reliabilityRequirement = requirement;
            return this;
        }

        public Builder preferredProviders(String... providers) {
            this.preferredProviders = Set.of(providers);
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public RoutingRequirement build() {
            return new RoutingRequirement(maxResponseTimeMs, qualityThreshold,
                    reliabilityRequirement, preferredProviders, urgency);
        }
    }
}
