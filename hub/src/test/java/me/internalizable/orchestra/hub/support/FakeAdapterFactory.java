package me.internalizable.orchestra.hub.support;

import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapterFactory;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out one {@link FakeAdapter} per server ID so tests can script it
 * before the hub creates it. Adapters queued with {@link #next(String)} are
 * handed out first, one per create call.
 */
public final class FakeAdapterFactory implements ServerAdapterFactory {

    public static final String TYPE = "fake";

    private final Map<String, FakeAdapter> adapters = new ConcurrentHashMap<>();
    private final Map<String, Queue<FakeAdapter>> queued = new ConcurrentHashMap<>();
    public final AtomicInteger created = new AtomicInteger();

    public FakeAdapter adapter(String serverId) {
        return adapters.computeIfAbsent(serverId, id -> new FakeAdapter());
    }

    /**
     * Queue a fresh adapter for the next start of a server.
     */
    public FakeAdapter next(String serverId) {
        FakeAdapter adapter = new FakeAdapter();
        queued.computeIfAbsent(serverId, id -> new ConcurrentLinkedQueue<>()).add(adapter);
        return adapter;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ServerAdapter create(ServerConfig config) {
        created.incrementAndGet();
        Queue<FakeAdapter> pending = queued.get(config.id());
        FakeAdapter fresh = pending != null ? pending.poll() : null;
        return fresh != null ? fresh : adapter(config.id());
    }
}
