package org.whiteelephant.service.play.store;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Accès aux lignes Game / Present utilisées par le moteur de tour.
 * <p>
 * Les méthodes conditionnelles renvoient {@code false} quand la garde n'a touché aucune ligne :
 * c'est le seul mécanisme qui départage deux actions concurrentes sur une même partie.
 * Toutes les écritures doivent se faire dans la transaction de l'appelant.
 */
public interface GameStateStore {

    Optional<GameState> findGame(UUID gameId);

    Optional<PresentState> findPresent(long presentId);

    /** started_at = now seulement si la partie n'a pas démarré. */
    boolean markStartedIfNotStarted(UUID gameId, LocalDateTime now);

    /** Écrit {@code value} dans la colonne du slot seulement si elle est vide. */
    boolean setIfEmpty(UUID gameId, GameSlot slot, long value, LocalDateTime now);

    /**
     * Si aucun joueur n'est actif, désigne au hasard un joueur de la partie qui ne possède aucun cadeau.
     * La garde et le tirage forment une seule écriture ; le joueur choisi peut être null s'il n'en reste aucun.
     */
    boolean rollPlayerIfEmpty(UUID gameId, LocalDateTime now);

    /** Termine le tour seulement si (player_id, present_id) valent encore les valeurs lues. */
    boolean clearTurnIf(UUID gameId, long playerId, long presentId, LocalDateTime now);

    void setPresentOwner(long presentId, Long ownerId, LocalDateTime now);

    int releasePresents(UUID gameId, LocalDateTime now);

    /** Vide player_id, present_id et started_at ; false si la partie n'existe pas. */
    boolean resetGame(UUID gameId, LocalDateTime now);
}
