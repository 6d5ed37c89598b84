package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity and static configuration of a managed server.
 *
 * <p>Immutable once created. The metadata map is opaque to the hub and
 * is handed to the server adapter unchanged.</p>
 *
 * @param id unique server identifier
 * @param type adapter kind used to manage this server
 * @param port server port
 * @param enabled whether the server is started automatically on hub initialization
 * @param metadata adapter-specific settings
 */
public record ServerConfig(
        String id,
        String type,
        int port,
        boolean enabled,
        Map<String, Object> metadata
) {

    public ServerConfig {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Get a metadata value.
     *
     * @param key metadata key
     * @return metadata value, or null if not set
     */
    @Nullable
    public Object getMetadata(@Nonnull String key) {
        return metadata.get(key);
    }

    /**
     * Get a metadata value as a string.
     *
     * @param key metadata key
     * @return string form of the value, or null if not set
     */
    @Nullable
    public String getMetadataString(@Nonnull String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Create a builder for server configurations.
     *
     * @param id server identifier
     * @return a new builder
     */
    @Nonnull
    public static Builder builder(@Nonnull String id) {
        return new ServerConfigBuilder(id);
    }

    /**
     * Builder for server configurations.
     */
    public interface Builder {
        Builder type(@Nonnull String type);
        Builder port(int port);
        Builder enabled(boolean enabled);
        Builder metadata(@Nonnull String key, @Nonnull Object value);
        Builder metadata(@Nonnull Map<String, Object> metadata);
        ServerConfig build();
    }
}
