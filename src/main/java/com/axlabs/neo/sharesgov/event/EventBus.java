package com.axlabs.neo.sharesgov.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Numbers, retains and delivers notifications.
 * <p>
 * Sequence numbers are scoped to the event name. The bus keeps the most recent notifications up to the history
 * capacity; older ones are dropped from the history.
 * <p>
 * Firing only records a notification and queues it. Listeners receive queued notifications, in firing order, when
 * {@link #deliverPending()} is called. The engine calls it after it released its own lock, so listeners may call back
 * into the engine.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, Long> sequences = new HashMap<>();
    private final Deque<Notification> history = new ArrayDeque<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Notification> pending = new ConcurrentLinkedQueue<>();
    private final ReentrantLock deliveryLock = new ReentrantLock();
    private int historyCapacity;

    public EventBus(int historyCapacity) {
        setHistoryCapacity(historyCapacity);
    }

    public void addListener(EventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(EventListener listener) {
        listeners.remove(listener);
    }

    public synchronized void setHistoryCapacity(int historyCapacity) {
        if (historyCapacity < 0) {
            throw new IllegalArgumentException("History capacity was negative");
        }
        this.historyCapacity = historyCapacity;
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
    }

    /**
     * Assigns the next sequence number for {@code eventName}, records the notification and queues it for the
     * listeners.
     *
     * @param eventName The event name.
     * @param state     The event arguments.
     * @return the notification.
     */
    public synchronized Notification fire(String eventName, Object... state) {
        long seq = sequences.getOrDefault(eventName, 0L);
        sequences.put(eventName, seq + 1);
        Notification ntf = new Notification(eventName, seq, new ArrayList<>(Arrays.asList(state)));
        if (historyCapacity > 0) {
            if (history.size() == historyCapacity) {
                history.removeFirst();
            }
            history.addLast(ntf);
        }
        pending.add(ntf);
        return ntf;
    }

    /**
     * Hands every queued notification to the listeners. If another thread is already delivering, that thread also
     * delivers the notifications queued by this one and the call returns right away.
     */
    public void deliverPending() {
        while (!pending.isEmpty() && deliveryLock.tryLock()) {
            try {
                Notification ntf;
                while ((ntf = pending.poll()) != null) {
                    deliver(ntf);
                }
            } finally {
                deliveryLock.unlock();
            }
        }
    }

    private void deliver(Notification ntf) {
        for (EventListener l : listeners) {
            try {
                l.onNotification(ntf);
            } catch (RuntimeException e) {
                // The operation that fired the event has already completed.
                log.warn("Listener failed on {}: {}", ntf, e.getMessage(), e);
            }
        }
    }

    /**
     * @return the retained notifications, oldest first.
     */
    public synchronized List<Notification> getNotifications() {
        return new ArrayList<>(history);
    }

    /**
     * @param eventName The event name.
     * @return the retained notifications with the given name, oldest first.
     */
    public synchronized List<Notification> getNotifications(String eventName) {
        List<Notification> l = new ArrayList<>();
        for (Notification n : history) {
            if (n.getEventName().equals(eventName)) {
                l.add(n);
            }
        }
        return l;
    }

    /**
     * @param eventName The event name.
     * @return the number of notifications ever fired with that name.
     */
    public synchronized long getCount(String eventName) {
        return sequences.getOrDefault(eventName, 0L);
    }
}
