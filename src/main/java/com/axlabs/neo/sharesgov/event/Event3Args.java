package com.axlabs.neo.sharesgov.event;

public class Event3Args<T1, T2, T3> extends Event {

    public Event3Args(String displayName, EventBus bus) {
        super(displayName, bus);
    }

    public Notification fire(T1 arg1, T2 arg2, T3 arg3) {
        return bus.fire(displayName, arg1, arg2, arg3);
    }
}
