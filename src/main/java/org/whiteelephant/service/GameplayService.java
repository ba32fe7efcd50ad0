package org.whiteelephant.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.GameStateSnapshot;
import org.whiteelephant.service.play.PlayConflictException;
import org.whiteelephant.service.play.PlayEventLog;
import org.whiteelephant.service.play.PlayNotFoundException;
import org.whiteelephant.service.play.store.GameSlot;
import org.whiteelephant.service.play.store.GameState;
import org.whiteelephant.service.play.store.GameStateStore;
import org.whiteelephant.service.play.store.PresentState;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Moteur de tour : start / reset / roll / pick / keep / steal.
 * <p>
 * Chaque action est une seule transaction : changement d'état et ligne du journal sont
 * commités ensemble ou pas du tout. Les courses entre deux actions sur la même partie
 * sont tranchées par les écritures conditionnelles du store, sans verrou applicatif.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameplayService {

    private final GameStateStore store;
    private final PlayEventLog eventLog;

    @Transactional
    public GameStateSnapshot start(UUID gameId) {
        if (!store.markStartedIfNotStarted(gameId, now())) {
            requireGame(gameId);
            throw new PlayConflictException("Game already started");
        }
        // le démarrage n'ouvre aucun tour : pas de joueur ni de cadeau dans la réponse
        GameState game = requireGame(gameId);
        return GameStateSnapshot.builder()
                .startedAt(game.startedAt())
                .updatedAt(game.updatedAt())
                .build();
    }

    /** Toujours possible tant que la partie existe ; efface l'historique. */
    @Transactional
    public GameStateSnapshot reset(UUID gameId) {
        LocalDateTime now = now();
        if (!store.resetGame(gameId, now)) {
            throw new PlayNotFoundException("Game not found");
        }
        int released = store.releasePresents(gameId, now);
        int deleted = eventLog.deleteAll(gameId);
        log.info("Game {} reset ({} presents released, {} events deleted)", gameId, released, deleted);
        return snapshot(requireGame(gameId));
    }

    @Transactional
    public GameStateSnapshot roll(UUID gameId) {
        if (!store.rollPlayerIfEmpty(gameId, now())) {
            requireGame(gameId);
            throw new PlayConflictException("A player is already taking a turn");
        }
        GameState game = requireGame(gameId);
        if (game.playerId() == null) {
            // l'écriture (null -> null) est annulée avec la transaction
            throw new PlayNotFoundException("No player left to roll");
        }
        eventLog.append(gameId, game.playerId(), null, null, null);
        return snapshot(game);
    }

    @Transactional
    public GameStateSnapshot pick(UUID gameId, long presentId) {
        GameState game = requireGame(gameId);
        PresentState present = requirePresentOf(gameId, presentId);
        if (present.isClaimed()) {
            throw new PlayConflictException("Present already claimed");
        }
        if (game.playerId() == null) {
            throw new PlayConflictException("No player is taking a turn");
        }
        // player_id ne peut changer qu'à la résolution du tour, qui exige present_id : on le capture ici
        long playerId = game.playerId();
        if (!store.setIfEmpty(gameId, GameSlot.PRESENT, presentId, now())) {
            throw new PlayConflictException("A present is already being contested");
        }
        eventLog.append(gameId, playerId, presentId, null, null);
        return snapshot(requireGame(gameId));
    }

    /** Le joueur garde le cadeau révélé ; les champs from_* répètent le joueur et le cadeau. */
    @Transactional
    public GameStateSnapshot keep(UUID gameId) {
        GameState game = requireActiveTurn(gameId);
        long playerId = game.playerId();
        long presentId = game.presentId();
        LocalDateTime now = now();

        endTurn(gameId, playerId, presentId, now);
        store.setPresentOwner(presentId, playerId, now);
        eventLog.append(gameId, playerId, presentId, playerId, presentId);
        return snapshot(requireGame(gameId));
    }

    /**
     * Le joueur prend {@code targetPresentId} ; l'ancien propriétaire reçoit le cadeau révélé.
     */
    @Transactional
    public GameStateSnapshot steal(UUID gameId, long targetPresentId) {
        GameState game = requireActiveTurn(gameId);
        long playerId = game.playerId();
        long contestedId = game.presentId();

        PresentState target = requirePresentOf(gameId, targetPresentId);
        if (target.id() == contestedId) {
            throw new PlayConflictException("Cannot steal the contested present");
        }
        if (!target.isClaimed()) {
            throw new PlayConflictException("Present is not owned by anyone");
        }
        long previousOwner = target.ownerId();
        LocalDateTime now = now();

        endTurn(gameId, playerId, contestedId, now);
        store.setPresentOwner(targetPresentId, playerId, now);
        store.setPresentOwner(contestedId, previousOwner, now);
        eventLog.append(gameId, playerId, targetPresentId, previousOwner, targetPresentId);
        return snapshot(requireGame(gameId));
    }

    // ---------- helpers ----------

    private void endTurn(UUID gameId, long playerId, long presentId, LocalDateTime now) {
        if (!store.clearTurnIf(gameId, playerId, presentId, now)) {
            throw new PlayConflictException("Turn already resolved");
        }
    }

    private GameState requireGame(UUID gameId) {
        return store.findGame(gameId).orElseThrow(() -> new PlayNotFoundException("Game not found"));
    }

    private GameState requireActiveTurn(UUID gameId) {
        GameState game = requireGame(gameId);
        if (!game.hasActiveTurn()) {
            throw new PlayConflictException("No present is being contested");
        }
        return game;
    }

    private PresentState requirePresentOf(UUID gameId, long presentId) {
        PresentState present = store.findPresent(presentId)
                .orElseThrow(() -> new PlayNotFoundException("Present not found"));
        if (!gameId.equals(present.gameId())) {
            throw new PlayNotFoundException("Present not found");
        }
        return present;
    }

    private LocalDateTime now() {
        return LocalDateTime.now();
    }

    private static GameStateSnapshot snapshot(GameState g) {
        return GameStateSnapshot.builder()
                .playerId(g.playerId())
                .presentId(g.presentId())
                .startedAt(g.startedAt())
                .updatedAt(g.updatedAt())
                .build();
    }
}
