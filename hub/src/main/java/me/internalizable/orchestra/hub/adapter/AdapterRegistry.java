package me.internalizable.orchestra.hub.adapter;

import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of adapter factories keyed by server type.
 *
 * <p>Populated at composition time. The lifecycle controller looks up the
 * factory for a server's type instead of branching on it.</p>
 */
public class AdapterRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, ServerAdapterFactory> factories = new ConcurrentHashMap<>();

    /**
     * Register an adapter factory.
     *
     * @param factory the factory
     * @return this registry
     * @throws IllegalStateException if the type is already registered
     */
    @Nonnull
    public AdapterRegistry register(@Nonnull ServerAdapterFactory factory) {
        Objects.requireNonNull(factory, "factory");
        String type = normalize(factory.type());

        ServerAdapterFactory existing = factories.putIfAbsent(type, factory);
        if (existing != null) {
            throw new IllegalStateException("Adapter type already registered: " + type);
        }

        LOGGER.debug("Registered adapter factory for type '{}'", type);
        return this;
    }

    /**
     * Check if a type has a registered factory.
     *
     * @param type server type
     * @return true if known
     */
    public boolean hasType(@Nullable String type) {
        return type != null && factories.containsKey(normalize(type));
    }

    /**
     * Get all registered types.
     *
     * @return sorted, unmodifiable set of type names
     */
    @Nonnull
    public Set<String> getTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Create a fresh adapter for a server.
     *
     * @param config the server's configuration
     * @return a new adapter owned by that server
     * @throws IllegalArgumentException if the type is not registered
     */
    @Nonnull
    public ServerAdapter create(@Nonnull ServerConfig config) {
        Objects.requireNonNull(config, "config");

        ServerAdapterFactory factory = config.type() != null ? factories.get(normalize(config.type())) : null;
        if (factory == null) {
            throw new IllegalArgumentException("Unknown server type: " + config.type());
        }

        ServerAdapter adapter = factory.create(config);
        return Objects.requireNonNull(adapter, "Adapter factory for '" + config.type() + "' returned null");
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
