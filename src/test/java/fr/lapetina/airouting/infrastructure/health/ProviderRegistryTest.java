package fr.lapetina.airouting.infrastructure.health;

import fr.lapetina.airouting.domain.model.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRegistryTest {

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
    }

    @Test
    @DisplayName("should list providers ordered by id")
    void shouldListOrdered() {
        registry.register(Provider.builder().id("gamma").build());
        registry.register(Provider.builder().id("alpha").build());

        assertThat(registry.getAll()).extracting(Provider::getId).containsExactly("alpha", "gamma");
    }

    @Test
    @DisplayName("should exclude disabled providers from routing candidates")
    void shouldExcludeDisabled() {
        registry.register(Provider.builder().id("alpha").build());
        registry.register(Provider.builder().id("beta").build());

        assertThat(registry.setEnabled("beta", false)).isTrue();
        assertThat(registry.setEnabled("nobody", false)).isFalse();

        assertThat(registry.getEnabled()).extracting(Provider::getId).containsExactly("alpha");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should auto-register only unknown providers")
    void shouldRegisterIfAbsent() {
        registry.register(Provider.builder().id("alpha").weight(3.0).build());

        assertThat(registry.registerIfAbsent("alpha")).isFalse();
        assertThat(registry.registerIfAbsent("beta")).isTrue();

        assertThat(registry.get("alpha").orElseThrow().getWeight()).isEqualTo(3.0);
        assertThat(registry.get("beta")).isPresent();
    }

    @Test
    @DisplayName("should replace the provider set and emit events")
    void shouldReplaceAll() {
        List<ProviderRegistry.ProviderRegistryEvent> events = new ArrayList<>();
        registry.register(Provider.builder().id("alpha").build());
        registry.register(Provider.builder().id("old").build());
        registry.addListener(events::add);

        registry.replaceAll(List.of(
                Provider.builder().id("alpha").weight(2.0).build(),
                Provider.builder().id("new").build()));

        assertThat(registry.getAll()).extracting(Provider::getId).containsExactly("alpha", "new");
        assertThat(events).extracting(ProviderRegistry.ProviderRegistryEvent::type).containsExactlyInAnyOrder(
                ProviderRegistry.ProviderRegistryEvent.Type.UPDATED,
                ProviderRegistry.ProviderRegistryEvent.Type.ADDED,
                ProviderRegistry.ProviderRegistryEvent.Type.REMOVED);
    }
}
