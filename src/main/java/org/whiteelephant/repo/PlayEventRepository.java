package org.whiteelephant.repo;

import org.whiteelephant.model.PlayEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface PlayEventRepository extends JpaRepository<PlayEvent, Long> {
    List<PlayEvent> findByGameIdOrderByIdAsc(UUID gameId);

    long countByGameId(UUID gameId);

    @Modifying
    @Query("delete from PlayEvent e where e.gameId = :gameId")
    int deleteByGameId(@Param("gameId") UUID gameId);
}
