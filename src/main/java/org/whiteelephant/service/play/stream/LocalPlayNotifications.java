package org.whiteelephant.service.play.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.PlayEventMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Canal de notification en mémoire pour un store sans LISTEN/NOTIFY (H2, instance unique).
 * Le journal y dépose chaque événement après commit, au même format JSON que le trigger PostgreSQL.
 */
@Slf4j
public class LocalPlayNotifications implements PlayNotificationSourceFactory {

    private final ObjectMapper objectMapper;
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

    public LocalPlayNotifications(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Appelé après commit ; une erreur ici ne concerne pas le client qui a joué. */
    public void fire(PlayEventMessage event) {
        try {
            queue.offer(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize play event {} for local notification", event.getId(), e);
        }
    }

    @Override
    public PlayNotificationSource open() {
        return new LocalSource();
    }

    @Override
    public String describe() {
        return "local in-process channel";
    }

    private final class LocalSource implements PlayNotificationSource {
        private volatile boolean closed;

        @Override
        public List<String> poll(Duration timeout) throws NotificationChannelException, InterruptedException {
            if (closed) throw new NotificationChannelException("Local notification source closed");
            String first = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (first == null) return List.of();
            List<String> payloads = new ArrayList<>();
            payloads.add(first);
            queue.drainTo(payloads);
            return payloads;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
