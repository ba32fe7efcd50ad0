package org.whiteelephant.service.play.stream;

import org.whiteelephant.dto.PlayEventMessage;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Curseur d'un abonné sur le hub. File bornée : quand elle est pleine, l'événement
 * non lu le plus ancien est perdu pour cet abonné seulement.
 */
public class PlayEventSubscription implements AutoCloseable {

    private final PlayEventHub hub;
    private final int capacity;
    private final ArrayDeque<PlayEventMessage> backlog;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    PlayEventSubscription(PlayEventHub hub, int capacity) {
        this.hub = hub;
        this.capacity = capacity;
        this.backlog = new ArrayDeque<>(capacity);
    }

    /** Appelé par le hub ; ne bloque jamais sur la vitesse de l'abonné. */
    boolean offer(PlayEventMessage event) {
        lock.lock();
        try {
            if (closed) return false;
            if (backlog.size() >= capacity) {
                backlog.pollFirst();
                dropped.incrementAndGet();
            }
            backlog.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attend au plus {@code timeout} le prochain événement.
     *
     * @return l'événement, ou null si le délai expire ou si l'abonnement est fermé
     */
    public PlayEventMessage poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (backlog.isEmpty()) {
                if (closed || nanos <= 0L) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return closed ? null : backlog.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** Nombre d'événements perdus parce que l'abonné était en retard. */
    public long dropped() {
        return dropped.get();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            backlog.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        hub.unsubscribe(this);
    }
}
