package org.whiteelephant.service.play.store;

import lombok.RequiredArgsConstructor;
import org.whiteelephant.model.Game;
import org.whiteelephant.model.Present;
import org.whiteelephant.repo.GameRepository;
import org.whiteelephant.repo.PresentRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class JpaGameStateStore implements GameStateStore {

    private final GameRepository gameRepo;
    private final PresentRepository presentRepo;

    @Override
    public Optional<GameState> findGame(UUID gameId) {
        return gameRepo.findById(gameId).map(JpaGameStateStore::toState);
    }

    @Override
    public Optional<PresentState> findPresent(long presentId) {
        return presentRepo.findById(presentId).map(JpaGameStateStore::toState);
    }

    @Override
    public boolean markStartedIfNotStarted(UUID gameId, LocalDateTime now) {
        return gameRepo.markStartedIfNotStarted(gameId, now) == 1;
    }

    @Override
    public boolean setIfEmpty(UUID gameId, GameSlot slot, long value, LocalDateTime now) {
        int updated = switch (slot) {
            case PRESENT -> gameRepo.setPresentIfEmpty(gameId, value, now);
        };
        return updated == 1;
    }

    @Override
    public boolean rollPlayerIfEmpty(UUID gameId, LocalDateTime now) {
        return gameRepo.rollPlayerIfEmpty(gameId, now) == 1;
    }

    @Override
    public boolean clearTurnIf(UUID gameId, long playerId, long presentId, LocalDateTime now) {
        return gameRepo.clearTurnIf(gameId, playerId, presentId, now) == 1;
    }

    @Override
    public void setPresentOwner(long presentId, Long ownerId, LocalDateTime now) {
        presentRepo.setOwner(presentId, ownerId, now);
    }

    @Override
    public int releasePresents(UUID gameId, LocalDateTime now) {
        return presentRepo.releaseAll(gameId, now);
    }

    @Override
    public boolean resetGame(UUID gameId, LocalDateTime now) {
        return gameRepo.resetState(gameId, now) == 1;
    }

    private static GameState toState(Game g) {
        return new GameState(g.getId(), g.getPlayerId(), g.getPresentId(), g.getStartedAt(), g.getUpdatedAt());
    }

    private static PresentState toState(Present p) {
        return new PresentState(p.getId(), p.getGameId(), p.getPlayerId());
    }
}
