package com.axlabs.neo.sharesgov.event;

public class Event2Args<T1, T2> extends Event {

    public Event2Args(String displayName, EventBus bus) {
        super(displayName, bus);
    }

    public Notification fire(T1 arg1, T2 arg2) {
        return bus.fire(displayName, arg1, arg2);
    }
}
