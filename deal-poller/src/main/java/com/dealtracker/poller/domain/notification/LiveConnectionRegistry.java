package com.dealtracker.poller.domain.notification;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Live viewers grouped by region. Safe for concurrent register, unregister and broadcast.
 */
@Slf4j
@Component
public class LiveConnectionRegistry {

    private final ConcurrentMap<String, Set<LiveConnection>> connectionsByRegion = new ConcurrentHashMap<>();

    public LiveHandle register(LiveConnection connection, String regionKey) {
        connectionsByRegion.computeIfAbsent(regionKey, key -> ConcurrentHashMap.newKeySet()).add(connection);
        log.info("live.registered: connection_id={}, region={}", connection.id(), regionKey);
        return new LiveHandle(connection, regionKey);
    }

    public void unregister(LiveHandle handle) {
        var connections = connectionsByRegion.get(handle.regionKey());
        var removed = connections != null && connections.remove(handle.connection());
        handle.connection().close();
        if (removed) {
            log.info("live.unregistered: connection_id={}, region={}",
                    handle.connection().id(), handle.regionKey());
        }
    }

    /**
     * Offers {@code payload} to every connection of the region. Connections that cannot take it
     * are dropped. Returns how many accepted it.
     */
    public int broadcast(String regionKey, String payload) {
        var connections = connectionsByRegion.get(regionKey);
        if (connections == null) {
            return 0;
        }
        var delivered = 0;
        for (var connection : connections) {
            if (connection.offer(payload)) {
                delivered++;
            } else {
                log.warn("live.dropped: connection_id={}, region={}, reason=buffer_full_or_closed",
                        connection.id(), regionKey);
                unregister(new LiveHandle(connection, regionKey));
            }
        }
        return delivered;
    }

    public int connectionCount() {
        return connectionsByRegion.values().stream().mapToInt(Set::size).sum();
    }

    public int connectionCount(String regionKey) {
        var connections = connectionsByRegion.get(regionKey);
        return connections == null ? 0 : connections.size();
    }

    public void closeAll() {
        connectionsByRegion.forEach((region, connections) ->
                connections.forEach(connection -> unregister(new LiveHandle(connection, region))));
    }
}
