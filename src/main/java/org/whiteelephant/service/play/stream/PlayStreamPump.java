package org.whiteelephant.service.play.stream;

import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.PlayEventMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

/**
 * Boucle d'une connexion : attend le prochain événement du hub ou l'échéance du heartbeat,
 * selon ce qui arrive en premier. Le heartbeat part à intervalle fixe même sous trafic.
 * Se termine dès que l'abonnement est fermé ou que l'envoi échoue, et libère l'abonnement.
 */
@Slf4j
class PlayStreamPump implements Runnable {

    private final UUID gameId;
    private final PlayEventSubscription subscription;
    private final PlayFrameSink sink;
    private final long heartbeatNanos;

    PlayStreamPump(UUID gameId, PlayEventSubscription subscription, PlayFrameSink sink, Duration heartbeat) {
        this.gameId = gameId;
        this.subscription = subscription;
        this.sink = sink;
        this.heartbeatNanos = heartbeat.toNanos();
    }

    @Override
    public void run() {
        long nextBeat = System.nanoTime() + heartbeatNanos;
        try {
            while (!subscription.isClosed()) {
                long wait = nextBeat - System.nanoTime();
                if (wait <= 0L) {
                    sink.sendHeartbeat();
                    nextBeat = System.nanoTime() + heartbeatNanos;
                    continue;
                }
                PlayEventMessage event = subscription.poll(Duration.ofNanos(wait));
                if (event != null && gameId.equals(event.getGameId())) {
                    sink.sendEvent(event);
                }
            }
        } catch (IOException | IllegalStateException e) {
            // client parti (ou émetteur déjà terminé)
            log.debug("Play stream for game {} closed: {}", gameId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.close();
            sink.complete();
        }
    }
}
