package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.PresenceEntry;
import ch.rps.rpsbackend.domain.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live connections and the room each of them is in.
 *
 * <p>The realtime gateway is the only writer. Each entry is replaced atomically per connection id,
 * readers always see a complete entry.
 */
@Component
@Slf4j
public class PresenceRegistry {

    private final ConcurrentMap<String, PresenceEntry> connections = new ConcurrentHashMap<>();

    public PresenceEntry connect(String connectionId, Long accountId, String displayName) {
        PresenceEntry entry = new PresenceEntry(connectionId, accountId, displayName, Room.NONE);
        PresenceEntry previous = connections.put(connectionId, entry);
        if (previous != null) {
            log.warn("Connection {} registered twice (account {} replaced by {})",
                    connectionId, previous.accountId(), accountId);
        }
        return entry;
    }

    public Optional<PresenceEntry> disconnect(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    /**
     * Moves a connection to another room.
     *
     * @return the updated entry, empty if the connection is unknown
     */
    public Optional<PresenceEntry> setRoom(String connectionId, Room room) {
        return Optional.ofNullable(connections.computeIfPresent(connectionId, (id, entry) -> entry.withRoom(room)));
    }

    public Optional<PresenceEntry> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * Accounts with at least one connection in the room, in no particular order.
     */
    public Set<Long> listRoom(Room room) {
        Set<Long> accounts = new LinkedHashSet<>();
        for (PresenceEntry entry : connections.values()) {
            if (room.equals(entry.room())) {
                accounts.add(entry.accountId());
            }
        }
        return accounts;
    }

    public List<PresenceEntry> connectionsIn(Room room) {
        return connections.values().stream()
                .filter(entry -> room.equals(entry.room()))
                .toList();
    }

    public List<PresenceEntry> connectionsOf(Long accountId) {
        return connections.values().stream()
                .filter(entry -> entry.accountId().equals(accountId))
                .toList();
    }

    public int size() {
        return connections.size();
    }
}
