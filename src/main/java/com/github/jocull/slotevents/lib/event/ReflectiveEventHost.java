package com.github.jocull.slotevents.lib.event;

import org.apache.commons.lang3.Validate;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Delivers callbacks by invoking a public, zero-argument method of the given name.
 */
public class ReflectiveEventHost implements EventHost {
    public static final ReflectiveEventHost INSTANCE = new ReflectiveEventHost();

    @Override
    public boolean isValid(Object handler) {
        if (handler == null) {
            return false;
        }
        if (handler instanceof Destroyable) {
            return !((Destroyable) handler).isDestroyed();
        }
        return true;
    }

    @Override
    public void deliver(Object handler, String callbackName) {
        Validate.notNull(handler, "handler");
        final Method method;
        try {
            method = handler.getClass().getMethod(callbackName);
        } catch (NoSuchMethodException ex) {
            throw new EventDeliveryException(callbackName,
                    "No public zero-argument method " + callbackName + " on " + describe(handler), ex);
        }

        try {
            method.invoke(handler);
        } catch (IllegalAccessException ex) {
            throw new EventDeliveryException(callbackName,
                    "Callback " + callbackName + " on " + describe(handler) + " is not accessible", ex);
        } catch (InvocationTargetException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new EventDeliveryException(callbackName,
                    "Callback " + callbackName + " on " + describe(handler) + " failed", cause);
        }
    }
}
