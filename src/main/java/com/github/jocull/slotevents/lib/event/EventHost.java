package com.github.jocull.slotevents.lib.event;

/**
 * Bridge into the environment that owns handler objects. The emitter never controls
 * handler lifetime, it only asks the host whether a reference is still usable.
 */
public interface EventHost {
    boolean isValid(Object handler);

    /**
     * Invokes the zero-argument method {@code callbackName} on {@code handler}.
     * Failures are not handled by the emitter and reach the caller of the broadcast.
     */
    void deliver(Object handler, String callbackName);

    default String describe(Object handler) {
        return handler == null ? "null" : handler.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(handler));
    }
}
