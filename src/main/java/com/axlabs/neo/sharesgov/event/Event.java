package com.axlabs.neo.sharesgov.event;

/**
 * An event without arguments.
 */
public class Event {

    protected final String displayName;
    protected final EventBus bus;

    public Event(String displayName, EventBus bus) {
        this.displayName = displayName;
        this.bus = bus;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Notification fire() {
        return bus.fire(displayName);
    }
}
