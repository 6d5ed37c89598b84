package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder implementation for server configurations.
 */
class ServerConfigBuilder implements ServerConfig.Builder {

    private final String id;
    private String type;
    private int port;
    private boolean enabled = true;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    ServerConfigBuilder(@Nonnull String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public ServerConfig.Builder type(@Nonnull String type) {
        this.type = Objects.requireNonNull(type, "type");
        return this;
    }

    @Override
    public ServerConfig.Builder port(int port) {
        this.port = port;
        return this;
    }

    @Override
    public ServerConfig.Builder enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    @Override
    public ServerConfig.Builder metadata(@Nonnull String key, @Nonnull Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        this.metadata.put(key, value);
        return this;
    }

    @Override
    public ServerConfig.Builder metadata(@Nonnull Map<String, Object> metadata) {
        Objects.requireNonNull(metadata, "metadata");
        this.metadata.putAll(metadata);
        return this;
    }

    @Override
    public ServerConfig build() {
        return new ServerConfig(id, type, port, enabled, metadata);
    }
}
