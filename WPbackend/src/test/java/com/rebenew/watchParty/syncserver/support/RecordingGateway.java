package com.rebenew.watchParty.syncserver.support;

import com.rebenew.watchParty.syncserver.core.ConnectionGateway;
import com.rebenew.watchParty.syncserver.model.OutboundType;
import com.rebenew.watchParty.syncserver.model.SyncMsg;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory gateway: remembers every message per connection. Only connections opened through
 * {@link #open(String...)} accept messages.
 */
public class RecordingGateway implements ConnectionGateway {

    private final Map<String, List<SyncMsg>> sent = new ConcurrentHashMap<>();
    private final Set<String> open = ConcurrentHashMap.newKeySet();

    public void open(String... connectionIds) {
        Collections.addAll(open, connectionIds);
    }

    public void close(String connectionId) {
        open.remove(connectionId);
    }

    @Override
    public boolean send(String connectionId, SyncMsg message) {
        if (connectionId == null || !open.contains(connectionId))
            return false;
        sent.computeIfAbsent(connectionId, id -> new CopyOnWriteArrayList<>()).add(message);
        return true;
    }

    @Override
    public boolean isOpen(String connectionId) {
        return connectionId != null && open.contains(connectionId);
    }

    @Override
    public int openConnectionCount() {
        return open.size();
    }

    public List<SyncMsg> sentTo(String connectionId) {
        return sent.getOrDefault(connectionId, List.of());
    }

    public List<SyncMsg> sentTo(String connectionId, OutboundType type) {
        return sentTo(connectionId).stream().filter(m -> m.getType() == type).collect(Collectors.toList());
    }

    public SyncMsg lastTo(String connectionId, OutboundType type) {
        List<SyncMsg> matching = sentTo(connectionId, type);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }

    public void clear() {
        sent.clear();
    }
}
