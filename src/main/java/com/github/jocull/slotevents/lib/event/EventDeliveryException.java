package com.github.jocull.slotevents.lib.event;

public class EventDeliveryException extends RuntimeException {
    private final String callbackName;

    public EventDeliveryException(String callbackName, String message, Throwable cause) {
        super(message, cause);
        this.callbackName = callbackName;
    }

    public String getCallbackName() {
        return callbackName;
    }
}
