package org.whiteelephant.service.play.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.PlayEventMessage;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tâche de fond unique par process : écoute le canal de notification du store
 * et republie chaque événement commité dans le {@link PlayEventHub}.
 * <p>
 * Un payload illisible est journalisé puis ignoré. La perte du canal arrête la boucle
 * (statut {@link Status#FAILED}) : plus aucun spectateur de ce process ne reçoit d'événement
 * jusqu'au redémarrage par le watchdog.
 */
@Slf4j
public class PlayEventNotifier implements SmartLifecycle {

    public enum Status { STOPPED, RUNNING, FAILED }

    private final PlayNotificationSourceFactory sources;
    private final PlayEventHub hub;
    private final ObjectMapper objectMapper;
    private final Duration pollTimeout;
    private final boolean autoRestart;

    private final Object monitor = new Object();
    private volatile boolean running;
    private volatile Status status = Status.STOPPED;
    private volatile String lastFailure;
    private volatile PlayNotificationSource source;
    private Thread worker;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong restarts = new AtomicLong();

    public PlayEventNotifier(PlayNotificationSourceFactory sources, PlayEventHub hub, ObjectMapper objectMapper,
                             Duration pollTimeout, boolean autoRestart) {
        this.sources = sources;
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.pollTimeout = pollTimeout;
        this.autoRestart = autoRestart;
    }

    @Override
    public void start() {
        synchronized (monitor) {
            if (running) return;
            running = true;
            status = Status.RUNNING;
            lastFailure = null;
            worker = new Thread(this::listen, "play-notifier");
            worker.setDaemon(true);
            worker.start();
        }
    }

    @Override
    public void stop() {
        Thread w;
        synchronized (monitor) {
            running = false;
            w = worker;
            worker = null;
            PlayNotificationSource src = source;
            if (src != null) src.close();
        }
        if (w != null) {
            w.interrupt();
            try {
                w.join(pollTimeout.toMillis() + 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (status != Status.FAILED) status = Status.STOPPED;
        log.info("Play event notifier stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public Status getStatus() {
        return status;
    }

    public String getLastFailure() {
        return lastFailure;
    }

    public long receivedCount() {
        return received.get();
    }

    public long malformedCount() {
        return malformed.get();
    }

    public long restartCount() {
        return restarts.get();
    }

    // relance la boucle si le canal a été perdu
    @Scheduled(fixedDelayString = "${app.play.notifier.watchdog-ms:10000}")
    public void watchdog() {
        if (status != Status.FAILED) return;
        if (!autoRestart) {
            log.error("Play event notifier is down ({}); live stream degraded until restart", lastFailure);
            return;
        }
        restarts.incrementAndGet();
        log.warn("Restarting play event notifier after failure: {}", lastFailure);
        start();
    }

    private void listen() {
        PlayNotificationSource src;
        try {
            src = sources.open();
        } catch (NotificationChannelException | RuntimeException e) {
            fail(e);
            return;
        }
        synchronized (monitor) {
            if (!running) {
                src.close();
                return;
            }
            source = src;
        }
        log.info("Play event notifier listening on {}", sources.describe());
        try {
            while (running) {
                List<String> payloads = src.poll(pollTimeout);
                for (String payload : payloads) {
                    handle(payload);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (running) fail(e);
        } catch (NotificationChannelException e) {
            // une fermeture demandée par stop() n'est pas une panne
            if (running) fail(e);
        } catch (RuntimeException e) {
            // erreur du driver ou du hub : la boucle est morte, le watchdog doit le voir
            fail(e);
        } finally {
            synchronized (monitor) {
                // un redémarrage a pu installer une nouvelle source entre-temps
                if (source == src) source = null;
            }
            src.close();
        }
    }

    void handle(String payload) {
        received.incrementAndGet();
        PlayEventMessage event;
        try {
            event = objectMapper.readValue(payload, PlayEventMessage.class);
        } catch (JsonProcessingException e) {
            malformed.incrementAndGet();
            log.warn("Dropping malformed play notification: {}", e.getOriginalMessage());
            return;
        }
        if (event == null || !event.isComplete()) {
            malformed.incrementAndGet();
            log.warn("Dropping incomplete play notification: {}", payload);
            return;
        }
        int n = hub.publish(event);
        log.debug("Sent play event {} to {} subscribers", event.getId(), n);
    }

    private void fail(Exception e) {
        synchronized (monitor) {
            running = false;
            status = Status.FAILED;
            lastFailure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        log.error("Play notification channel failed; live events halted for this process", e);
    }
}
