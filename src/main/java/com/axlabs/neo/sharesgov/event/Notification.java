package com.axlabs.neo.sharesgov.event;

import java.util.Collections;
import java.util.List;

/**
 * A fired event. The sequence number starts at 0 and increases by one for every notification with the same event
 * name.
 */
public class Notification {

    private final String eventName;
    private final long sequence;
    private final List<Object> state;

    public Notification(String eventName, long sequence, List<Object> state) {
        this.eventName = eventName;
        this.sequence = sequence;
        this.state = Collections.unmodifiableList(state);
    }

    public String getEventName() {
        return eventName;
    }

    public long getSequence() {
        return sequence;
    }

    public List<Object> getState() {
        return state;
    }

    @Override
    public String toString() {
        return eventName + "#" + sequence + state;
    }
}
