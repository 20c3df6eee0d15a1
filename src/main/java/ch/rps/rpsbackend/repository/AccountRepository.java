package ch.rps.rpsbackend.repository;

import ch.rps.rpsbackend.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Repository for {@link Account} entities.
 *
 * <p>Rating changes are applied as increments in a single UPDATE so that concurrent sessions
 * of the same account never overwrite each other's result.
 */
public interface AccountRepository extends JpaRepository<Account, Long> {

    List<Account> findAllByOrderByRatingDesc();

    List<Account> findByUsernameContainingIgnoreCaseOrderByRatingDesc(String username);

    /**
     * Adds the result of one completed session to an account.
     *
     * @param id    account id
     * @param delta signed rating change
     * @param won   1 if the account won, 0 otherwise
     * @param lost  1 if the account lost, 0 otherwise
     * @param tied  1 if the session was a tie, 0 otherwise
     * @return number of updated rows (0 if the account does not exist)
     */
    @Modifying
    @Query("UPDATE Account a SET a.rating = a.rating + :delta, " +
            "a.gamesPlayed = a.gamesPlayed + 1, " +
            "a.gamesWon = a.gamesWon + :won, " +
            "a.gamesLost = a.gamesLost + :lost, " +
            "a.gamesTied = a.gamesTied + :tied " +
            "WHERE a.id = :id")
    int applyResult(@Param("id") Long id,
                    @Param("delta") int delta,
                    @Param("won") int won,
                    @Param("lost") int lost,
                    @Param("tied") int tied);
}
