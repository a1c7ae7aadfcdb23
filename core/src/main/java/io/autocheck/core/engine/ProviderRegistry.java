package io.autocheck.core.engine;

import io.autocheck.core.config.CompilerSettings;
import io.autocheck.core.engine.provider.CustomEnvironment;
import io.autocheck.core.engine.provider.ElixirEnvironment;
import io.autocheck.core.engine.provider.JavaEnvironment;
import io.autocheck.core.spi.EnvironmentProvider;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for environment providers. Manages registration and lookup by provider id; each
 * provider's capability table is built once, at registration. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class ProviderRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    /** Providers shipped with the compiler. */
    public static final List<EnvironmentProvider> BUILT_IN_PROVIDERS =
            List.of(new CustomEnvironment(), new ElixirEnvironment(), new JavaEnvironment());

    private final Map<String, Registration> providers = new ConcurrentHashMap<>();

    /**
     * A registered provider together with its capability table.
     *
     * @param provider     the provider
     * @param capabilities the provider's capabilities indexed by name and arity
     */
    public record Registration(EnvironmentProvider provider, CapabilityTable capabilities) {

        public String id() {
            return provider.id();
        }
    }

    /** Creates a registry holding every built-in provider. */
    public static ProviderRegistry withBuiltIns() {
        ProviderRegistry registry = new ProviderRegistry();
        BUILT_IN_PROVIDERS.forEach(registry::register);
        return registry;
    }

    /**
     * Creates a registry holding the built-in providers enabled in the settings. Enabled ids that
     * name no built-in provider are logged and skipped.
     */
    public static ProviderRegistry fromSettings(CompilerSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        ProviderRegistry registry = new ProviderRegistry();
        for (EnvironmentProvider provider : BUILT_IN_PROVIDERS) {
            if (settings.enabledProviders().contains(provider.id())) {
                registry.register(provider);
            }
        }
        for (String id : settings.enabledProviders()) {
            if (!registry.hasProvider(id)) {
                LOG.warn("Enabled provider '{}' is not a built-in provider, ignored", id);
            }
        }
        return registry;
    }

    /**
     * Registers a provider. If a provider with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param provider the provider to register
     * @throws NullPointerException     if provider or provider.id() is null
     * @throws IllegalArgumentException if provider.id() is empty or its capabilities clash
     */
    public void register(EnvironmentProvider provider) {
        if (provider == null) {
            throw new NullPointerException("provider must not be null");
        }
        String id = provider.id();
        if (id == null) {
            throw new NullPointerException("provider id must not be null");
        }
        if (id.isEmpty()) {
            throw new IllegalArgumentException("provider id must not be empty");
        }
        CapabilityTable capabilities = CapabilityTable.of(provider.capabilities());
        providers.put(id, new Registration(provider, capabilities));
        LOG.debug("Registered environment provider: id={}, capabilities={}", id, capabilities.names());
    }

    /**
     * Looks up a provider by id.
     *
     * @param providerId the provider identifier (e.g. "elixir")
     * @return the registration, or empty if not registered
     */
    public Optional<Registration> getRegistration(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    /** Looks up a provider by id, or empty if not registered. */
    public Optional<EnvironmentProvider> getProvider(String providerId) {
        return getRegistration(providerId).map(Registration::provider);
    }

    /** Registered provider ids in sorted order. */
    public Set<String> providerIds() {
        return new TreeSet<>(providers.keySet());
    }

    /** Returns the number of registered providers. */
    public int size() {
        return providers.size();
    }

    /** Returns {@code true} if a provider with the given id is registered. */
    public boolean hasProvider(String providerId) {
        return providers.containsKey(providerId);
    }
}
