package org.whiteelephant.service.play;

import lombok.RequiredArgsConstructor;
import org.whiteelephant.dto.PlayEventMessage;
import org.whiteelephant.model.PlayEvent;
import org.whiteelephant.repo.PlayEventRepository;
import org.whiteelephant.service.play.stream.LocalPlayNotifications;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Journal append-only des actions de jeu. N'écrit que dans la transaction de l'action
 * qu'il documente : l'événement n'est visible (et notifié) qu'après commit.
 */
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class PlayEventLog {

    private final PlayEventRepository repo;
    private final ObjectProvider<LocalPlayNotifications> localNotifications;

    public PlayEvent append(UUID gameId, long playerId, Long presentId, Long fromPlayerId, Long fromPresentId) {
        PlayEvent saved = repo.saveAndFlush(PlayEvent.builder()
                .gameId(gameId)
                .playerId(playerId)
                .presentId(presentId)
                .fromPlayerId(fromPlayerId)
                .fromPresentId(fromPresentId)
                .build());

        // sans trigger PostgreSQL : on rejoue le contrat de notification après commit
        LocalPlayNotifications local = localNotifications.getIfAvailable();
        if (local != null) {
            PlayEventMessage msg = PlayEventMessage.of(saved);
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    local.fire(msg);
                }
            });
        }
        return saved;
    }

    /** Efface tout l'historique de la partie (reset uniquement). */
    public int deleteAll(UUID gameId) {
        return repo.deleteByGameId(gameId);
    }
}
