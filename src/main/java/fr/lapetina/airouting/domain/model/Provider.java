package fr.lapetina.airouting.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A backend AI provider that requests can be routed to.
 * Immutable; the registry swaps instances to change configuration.
 */
public final class Provider {
    private final String id;
    private final List<String> models;
    private final double weight;
    private final boolean enabled;

    private Provider(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.models = List.copyOf(builder.models);
        if (builder.weight < 0) {
            throw new IllegalArgumentException("Weight must be >= 0: " + builder.weight);
        }
        this.weight = builder.weight;
        this.enabled = builder.enabled;
    }

    public String getId() {
        return id;
    }

    public List<String> getModels() {
        return models;
    }

    /**
     * The model a request is sent to when this provider is selected.
     */
    public String getDefaultModel() {
        return models.isEmpty() ? "default" : models.get(0);
    }

    public double getWeight() {
        return weight;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Provider withEnabled(boolean newEnabled) {
        return builder().id(id).models(models).weight(weight).enabled(newEnabled).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provider that = (Provider) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Provider{" +
                "id='" + id + '\'' +
                ", models=" + models +
                ", weight=" + weight +
                ", enabled=" + enabled +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private final List<String> models = new ArrayList<>();
        private double weight = 1.0;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder models(List<String> models) {
            this.models.addAll(models);
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Provider build() {
            return new Provider(this);
        }
    }
}
