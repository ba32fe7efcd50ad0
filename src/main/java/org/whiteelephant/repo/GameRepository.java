package org.whiteelephant.repo;

import org.whiteelephant.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.UUID;

public interface GameRepository extends JpaRepository<Game, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Game g set g.startedAt = :now, g.updatedAt = :now where g.id = :id and g.startedAt is null")
    int markStartedIfNotStarted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Game g set g.presentId = :presentId, g.updatedAt = :now where g.id = :id and g.presentId is null")
    int setPresentIfEmpty(@Param("id") UUID id, @Param("presentId") long presentId, @Param("now") LocalDateTime now);

    // garde + tirage aléatoire en une seule requête : un second roll concurrent voit 0 ligne
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE games SET player_id = (
                SELECT p.id FROM players p
                WHERE p.game_id = :id
                  AND p.id NOT IN (
                      SELECT pr.player_id FROM presents pr
                      WHERE pr.game_id = :id AND pr.player_id IS NOT NULL)
                ORDER BY random()
                LIMIT 1),
              updated_at = :now
            WHERE id = :id AND player_id IS NULL
            """, nativeQuery = true)
    int rollPlayerIfEmpty(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Game g set g.playerId = null, g.presentId = null, g.updatedAt = :now " +
            "where g.id = :id and g.playerId = :playerId and g.presentId = :presentId")
    int clearTurnIf(@Param("id") UUID id, @Param("playerId") long playerId,
                    @Param("presentId") long presentId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Game g set g.playerId = null, g.presentId = null, g.startedAt = null, g.updatedAt = :now where g.id = :id")
    int resetState(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
