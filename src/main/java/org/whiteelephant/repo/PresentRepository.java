package org.whiteelephant.repo;

import org.whiteelephant.model.Present;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.UUID;

public interface PresentRepository extends JpaRepository<Present, Long> {
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Present p set p.playerId = :owner, p.updatedAt = :now where p.id = :id")
    int setOwner(@Param("id") long id, @Param("owner") Long owner, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Present p set p.playerId = null, p.updatedAt = :now where p.gameId = :gameId")
    int releaseAll(@Param("gameId") UUID gameId, @Param("now") LocalDateTime now);
}
