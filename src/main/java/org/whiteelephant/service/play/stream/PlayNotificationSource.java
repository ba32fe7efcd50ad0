package org.whiteelephant.service.play.stream;

import java.time.Duration;
import java.util.List;

/** Abonnement ouvert sur le canal de notification des événements de jeu. */
public interface PlayNotificationSource extends AutoCloseable {

    /**
     * Attend au plus {@code timeout} et renvoie les payloads JSON reçus (liste vide si rien).
     *
     * @throws NotificationChannelException si le canal est fermé ou en erreur : l'abonnement est perdu
     */
    List<String> poll(Duration timeout) throws NotificationChannelException, InterruptedException;

    @Override
    void close();
}
