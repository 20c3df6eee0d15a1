package ch.rps.rpsbackend.domain;

import java.util.Objects;

/**
 * Account bound to a session slot, with the display name captured when it was bound.
 *
 * @param accountId   numeric account identity
 * @param displayName name shown to the opponent
 */
public record Participant(Long accountId, String displayName) {

    public Participant {
        Objects.requireNonNull(accountId, "accountId");
    }

    public boolean is(Long otherAccountId) {
        return accountId.equals(otherAccountId);
    }
}
