package fr.lapetina.airouting.infrastructure.health;

import fr.lapetina.airouting.domain.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the providers the router may select.
 *
 * Thread-safe. Providers come from configuration and are also registered on first
 * sight when a request is tracked against an id the registry does not know yet.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers = new ConcurrentHashMap<>();
    private final List<Consumer<ProviderRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new provider or replaces an existing one.
     */
    public void register(Provider provider) {
        Provider previous = providers.put(provider.getId(), provider);
        if (previous == null) {
            log.info("Provider registered: {}", provider);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.ADDED, provider));
        } else {
            log.info("Provider updated: {}", provider);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.UPDATED, provider));
        }
    }

    /**
     * Registers a provider with default settings unless it is already known.
     *
     * @return true if the provider was added
     */
    public boolean registerIfAbsent(String providerId) {
        Provider created = Provider.builder().id(providerId).build();
        Provider existing = providers.putIfAbsent(providerId, created);
        if (existing == null) {
            log.info("Provider auto-registered on first use: provider={}", providerId);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.ADDED, created));
            return true;
        }
        return false;
    }

    public Provider remove(String providerId) {
        Provider removed = providers.remove(providerId);
        if (removed != null) {
            log.info("Provider removed: {}", removed);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.REMOVED, removed));
        }
        return removed;
    }

    public Optional<Provider> get(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    /**
     * All providers, ordered by id.
     */
    public List<Provider> getAll() {
        return providers.values().stream()
                .sorted(Comparator.comparing(Provider::getId))
                .toList();
    }

    /**
     * Providers eligible for routing, ordered by id.
     */
    public List<Provider> getEnabled() {
        return providers.values().stream()
                .filter(Provider::isEnabled)
                .sorted(Comparator.comparing(Provider::getId))
                .toList();
    }

    /**
     * Enables or disables a provider.
     *
     * @return false if the provider is unknown
     */
    public boolean setEnabled(String providerId, boolean enabled) {
        Provider current = providers.get(providerId);
        if (current == null) {
            return false;
        }
        if (current.isEnabled() != enabled) {
            register(current.withEnabled(enabled));
        }
        return true;
    }

    /**
     * Replaces all providers with a new set.
     * Used for configuration reload.
     */
    public void replaceAll(Collection<Provider> newProviders) {
        Set<String> newIds = new HashSet<>();

        for (Provider provider : newProviders) {
            newIds.add(provider.getId());
            register(provider);
        }

        for (String existingId : new ArrayList<>(providers.keySet())) {
            if (!newIds.contains(existingId)) {
                remove(existingId);
            }
        }

        log.info("Provider registry replaced: {} providers", providers.size());
    }

    public void addListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.add(listener);
    }

    private void notifyListeners(ProviderRegistryEvent event) {
        for (Consumer<ProviderRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return providers.size();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    /**
     * Event for provider registry changes.
     */
    public record ProviderRegistryEvent(Type type, Provider provider) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
