package com.github.jocull.slotevents.lib.event;

import java.util.Objects;

/**
 * A single {@code (handler, callbackName)} entry of an event slot.
 * The handler is {@code null} once its weak reference has been cleared.
 */
public class EventRegistration {
    private final Object handler;
    private final String callbackName;

    public EventRegistration(Object handler, String callbackName) {
        this.handler = handler;
        this.callbackName = callbackName;
    }

    public Object getHandler() {
        return handler;
    }

    public String getCallbackName() {
        return callbackName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventRegistration that = (EventRegistration) o;
        return handler == that.handler && Objects.equals(callbackName, that.callbackName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(handler), callbackName);
    }

    @Override
    public String toString() {
        return "EventRegistration{" +
                "handler=" + handler +
                ", callbackName='" + callbackName + '\'' +
                '}';
    }
}
