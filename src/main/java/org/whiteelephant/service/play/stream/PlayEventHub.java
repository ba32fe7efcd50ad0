package org.whiteelephant.service.play.stream;

import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.PlayEventMessage;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Diffusion en mémoire des événements de jeu vers N abonnés indépendants.
 * Alimenté uniquement par {@link PlayEventNotifier} ; instance unique créée par {@code PlayStreamConfig}.
 */
@Slf4j
public class PlayEventHub {

    private final int capacity;
    private final Set<PlayEventSubscription> subscribers = new CopyOnWriteArraySet<>();

    public PlayEventHub(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    public PlayEventSubscription subscribe() {
        PlayEventSubscription sub = new PlayEventSubscription(this, capacity);
        subscribers.add(sub);
        return sub;
    }

    /**
     * Remet l'événement à chaque abonné courant. Ne bloque pas et n'échoue pas
     * si un abonné est en retard ou s'il n'y en a aucun.
     *
     * @return nombre d'abonnés ayant reçu l'événement
     */
    public int publish(PlayEventMessage event) {
        int delivered = 0;
        for (PlayEventSubscription sub : subscribers) {
            long droppedBefore = sub.dropped();
            if (sub.offer(event)) {
                delivered++;
                if (sub.dropped() > droppedBefore) {
                    log.warn("Play stream subscriber lagging, oldest event dropped (total dropped={})", sub.dropped());
                }
            }
        }
        return delivered;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    void unsubscribe(PlayEventSubscription sub) {
        subscribers.remove(sub);
    }
}
