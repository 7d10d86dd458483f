package com.axlabs.neo.sharesgov.event;

public class Event4Args<T1, T2, T3, T4> extends Event {

    public Event4Args(String displayName, EventBus bus) {
        super(displayName, bus);
    }

    public Notification fire(T1 arg1, T2 arg2, T3 arg3, T4 arg4) {
        return bus.fire(displayName, arg1, arg2, arg3, arg4);
    }
}
