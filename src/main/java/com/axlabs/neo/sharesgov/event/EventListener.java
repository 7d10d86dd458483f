package com.axlabs.neo.sharesgov.event;

/**
 * Receives notifications after the operation that fired them has returned its lock. Runs on the thread of a caller of
 * the engine, so a slow listener delays that caller only.
 */
@FunctionalInterface
public interface EventListener {

    void onNotification(Notification notification);
}
