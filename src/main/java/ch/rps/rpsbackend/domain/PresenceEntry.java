package ch.rps.rpsbackend.domain;

/**
 * Live connection of an account and the room it is currently in.
 *
 * <p>Entries are immutable; moving a connection to another room replaces its entry.
 *
 * @param connectionId STOMP session id of the connection
 * @param accountId    account that opened the connection
 * @param displayName  account display name
 * @param room         current room
 */
public record PresenceEntry(String connectionId, Long accountId, String displayName, Room room) {

    public PresenceEntry withRoom(Room newRoom) {
        return new PresenceEntry(connectionId, accountId, displayName, newRoom);
    }

    public Participant asParticipant() {
        return new Participant(accountId, displayName);
    }
}
