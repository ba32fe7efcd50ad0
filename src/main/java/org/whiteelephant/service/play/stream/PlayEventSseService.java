package org.whiteelephant.service.play.stream;

import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.PlayEventMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

/**
 * Flux SSE des événements d'une partie : un abonnement au hub par connexion,
 * libéré dès la déconnexion. Pas de rattrapage des événements antérieurs.
 */
@Slf4j
@Service
public class PlayEventSseService {

    private final PlayEventHub hub;
    private final TaskExecutor executor;
    private final Duration heartbeat;
    private final long timeoutMs;

    public PlayEventSseService(PlayEventHub hub,
                               @Qualifier("playStreamExecutor") TaskExecutor executor,
                               @Value("${app.play.stream.heartbeat-ms:15000}") long heartbeatMs,
                               @Value("${app.play.stream.timeout-ms:21600000}") long timeoutMs) {
        this.hub = hub;
        this.executor = executor;
        this.heartbeat = Duration.ofMillis(heartbeatMs);
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter open(UUID gameId) {
        // 6h par défaut : suffisant derrière un proxy, le heartbeat garde la connexion vivante
        SseEmitter emitter = new SseEmitter(timeoutMs);
        PlayEventSubscription sub = hub.subscribe();

        emitter.onCompletion(sub::close);
        emitter.onTimeout(sub::close);
        emitter.onError(e -> sub.close());

        try {
            emitter.send(SseEmitter.event().name("connected").data("ok"));
        } catch (IOException e) {
            sub.close();
            emitter.completeWithError(e);
            return emitter;
        }

        try {
            executor.execute(new PlayStreamPump(gameId, sub, new EmitterSink(emitter), heartbeat));
        } catch (TaskRejectedException e) {
            sub.close();
            log.warn("Rejecting play stream for game {}: no stream worker available", gameId);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many live viewers");
        }
        return emitter;
    }

    private static final class EmitterSink implements PlayFrameSink {
        private final SseEmitter emitter;

        EmitterSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void sendEvent(PlayEventMessage event) throws IOException {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.getId()))
                    .name("play")
                    .data(event, MediaType.APPLICATION_JSON));
        }

        @Override
        public void sendHeartbeat() throws IOException {
            emitter.send(SseEmitter.event().name("ping").data("keepalive"));
        }

        @Override
        public void complete() {
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.trace("Emitter already completed");
            }
        }
    }
}
