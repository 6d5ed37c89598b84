package me.internalizable.orchestra.api.hub.adapter;

import me.internalizable.orchestra.api.hub.ServerConfig;

import javax.annotation.Nonnull;

/**
 * Creates adapters for one kind of managed server.
 *
 * <p>Factories are registered with the hub at composition time. Adding a new
 * kind of server means registering another factory.</p>
 */
public interface ServerAdapterFactory {

    /**
     * Get the server type this factory handles.
     *
     * @return type name, matched case-insensitively against {@link ServerConfig#type()}
     */
    @Nonnull
    String type();

    /**
     * Create a new adapter for a server.
     *
     * @param config the server's configuration
     * @return a fresh adapter owned by that server
     */
    @Nonnull
    ServerAdapter create(@Nonnull ServerConfig config);
}
