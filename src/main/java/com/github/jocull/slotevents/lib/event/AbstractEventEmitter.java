package com.github.jocull.slotevents.lib.event;

import com.github.jocull.slotevents.lib.ArrayUtilities;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Base for objects which broadcast a fixed set of events to previously registered handlers.
 * <p>
 * Each event slot keeps its handlers in registration order. A handler is stored by weak
 * reference together with the name of the callback to invoke, and may be registered any number
 * of times under the same or different names. Handlers which became invalid without
 * unregistering are skipped while broadcasting and dropped by the next registry sweep.
 * <p>
 * Registering and unregistering is refused while a broadcast is running on this emitter.
 * Misuse is logged and otherwise ignored. Instances are not thread safe.
 */
public abstract class AbstractEventEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractEventEmitter.class);

    private final EventHost host;

    private boolean handlersInitialized;
    private HandlerReference[][] handlers;
    private String[][] callbackNames;
    private int eventStackIndex;

    protected AbstractEventEmitter() {
        this(ReflectiveEventHost.INSTANCE);
    }

    protected AbstractEventEmitter(EventHost host) {
        this.host = Validate.notNull(host, "host");
    }

    /**
     * Total number of event slots. Must not change over the lifetime of the emitter.
     */
    public abstract int getEventCount();

    /**
     * Depth of broadcasts currently running on this emitter, zero when idle.
     */
    protected int getEventStackIndex() {
        return eventStackIndex;
    }

    public boolean isUpdatingHandlers() {
        return eventStackIndex > 0;
    }

    private void initializeHandlers() {
        if (handlersInitialized) {
            return;
        }

        final int eventCount = getEventCount();
        if (eventCount < 0) {
            throw new IllegalStateException("Event count must not be negative: " + eventCount);
        }

        handlers = new HandlerReference[eventCount][];
        callbackNames = new String[eventCount][];
        for (int i = 0; i < eventCount; i++) {
            handlers[i] = new HandlerReference[0];
            callbackNames[i] = new String[0];
        }
        handlersInitialized = true;
    }

    private boolean isValidSlot(int eventId) {
        return eventId >= 0 && eventId < handlers.length;
    }

    public void registerHandler(int eventId, Object handler, String callbackName) {
        initializeHandlers();

        if (!host.isValid(handler)) {
            LOGGER.error("Attempted to register invalid handler {} with event slot {}", host.describe(handler), eventId);
            return;
        }
        if (!isValidSlot(eventId)) {
            LOGGER.error("Attempted to register invalid event slot {} with handler {}#{}", eventId, host.describe(handler), callbackName);
            return;
        }
        if (StringUtils.isEmpty(callbackName)) {
            LOGGER.error("Attempted to register empty callback name for event slot {} with handler {}", eventId, host.describe(handler));
            return;
        }
        if (eventStackIndex > 0) {
            LOGGER.error("Attempted to register handler {}#{} for event slot {} while event handler update is in progress",
                    host.describe(handler), callbackName, eventId);
            return;
        }

        cleanupHandlers();

        handlers[eventId] = ArrayUtilities.append(handlers[eventId], new HandlerReference(handler));
        callbackNames[eventId] = ArrayUtilities.append(callbackNames[eventId], callbackName);
        LOGGER.trace("Registered handler {}#{} for event slot {}", host.describe(handler), callbackName, eventId);
    }

    /**
     * Removes the first registration of {@code handler} under {@code callbackName} for the given slot.
     */
    public void unregisterHandler(int eventId, Object handler, String callbackName) {
        if (!handlersInitialized) {
            return;
        }

        if (!host.isValid(handler)) {
            LOGGER.error("Attempted to unregister invalid handler {} from event slot {}", host.describe(handler), eventId);
            return;
        }
        if (!isValidSlot(eventId)) {
            LOGGER.error("Attempted to unregister invalid event slot {} with handler {}#{}", eventId, host.describe(handler), callbackName);
            return;
        }
        if (StringUtils.isEmpty(callbackName)) {
            LOGGER.error("Attempted to unregister empty callback name from event slot {} with handler {}", eventId, host.describe(handler));
            return;
        }
        if (eventStackIndex > 0) {
            LOGGER.error("Attempted to unregister handler {}#{} from event slot {} while event handler update is in progress",
                    host.describe(handler), callbackName, eventId);
            return;
        }

        cleanupHandlers();

        final HandlerReference[] handlerList = handlers[eventId];
        final String[] names = callbackNames[eventId];
        final Object[] referents = dereference(handlerList);

        // A handler may occur several times, and find() matches by equals, so keep looking until
        // both the exact instance and the callback name match
        int offset = -1;
        while (true) {
            final int location = ArrayUtilities.find(referents, handler, offset + 1);
            if (location == ArrayUtilities.NOT_FOUND) {
                LOGGER.trace("No registration of {}#{} in event slot {}", host.describe(handler), callbackName, eventId);
                return;
            }
            offset = location;
            if (referents[location] == handler && callbackName.equals(names[location])) {
                break;
            }
        }

        handlers[eventId] = ArrayUtilities.removeAt(handlerList, offset);
        callbackNames[eventId] = ArrayUtilities.removeAt(names, offset);
        LOGGER.trace("Unregistered handler {}#{} from event slot {}", host.describe(handler), callbackName, eventId);
    }

    /**
     * Removes every registration of {@code handler} from all slots.
     * <p>
     * The handler does not need to be valid anymore, so this also serves as cleanup for handlers
     * that have already been destroyed.
     */
    public void unregisterHandler(Object handler) {
        if (handler == null) {
            LOGGER.error("Attempted to unregister null handler from all event slots");
            return;
        }
        if (eventStackIndex > 0) {
            LOGGER.error("Attempted to unregister handler {} from all event slots while event handler update is in progress",
                    host.describe(handler));
            return;
        }
        if (!handlersInitialized) {
            return;
        }

        final int removed = removeRegistrations(referent -> referent == handler);
        LOGGER.trace("Unregistered {} registrations of handler {}", removed, host.describe(handler));
    }

    /**
     * Drops registrations whose handler is no longer valid. Does nothing while a broadcast is running.
     */
    protected void cleanupHandlers() {
        if (!handlersInitialized || eventStackIndex > 0) {
            return;
        }

        final int removed = removeRegistrations(referent -> !host.isValid(referent));
        if (removed > 0) {
            LOGGER.debug("Removed {} stale handler registrations", removed);
        }
    }

    private int removeRegistrations(Predicate<Object> predicate) {
        int total = 0;
        for (int i = 0; i < handlers.length; i++) {
            final HandlerReference[] handlerList = handlers[i];
            final String[] names = callbackNames[i];

            final HandlerReference[] keptHandlers = new HandlerReference[handlerList.length];
            final String[] keptNames = new String[names.length];
            int removed = 0;
            for (int j = 0; j < handlerList.length; j++) {
                if (predicate.test(handlerList[j].get())) {
                    removed++;
                    continue;
                }
                keptHandlers[j - removed] = handlerList[j];
                keptNames[j - removed] = names[j];
            }

            if (removed == 0) {
                continue;
            }
            handlers[i] = Arrays.copyOf(keptHandlers, handlerList.length - removed);
            callbackNames[i] = Arrays.copyOf(keptNames, names.length - removed);
            total += removed;
        }
        return total;
    }

    /**
     * Delivers the given event to every handler registered for it, in registration order.
     * Exceptions thrown by a callback abort the broadcast and propagate to the caller.
     */
    protected void emitEvent(int eventId) {
        if (!handlersInitialized) {
            return;
        }
        if (!isValidSlot(eventId)) {
            LOGGER.error("Attempted to emit event with invalid id {}", eventId);
            return;
        }

        eventStackIndex++;
        try {
            final HandlerReference[] handlerList = handlers[eventId];
            final String[] names = callbackNames[eventId];
            for (int i = 0; i < handlerList.length; i++) {
                final Object handler = handlerList[i].get();
                final String callbackName = names[i];
                if (!host.isValid(handler)) {
                    LOGGER.warn("Stale reference to event handler {}#{} for event {} - Skipped",
                            host.describe(handler), callbackName, eventId);
                    continue;
                }
                host.deliver(handler, callbackName);
            }
        } finally {
            eventStackIndex--;
        }
    }

    public int getHandlerCount(int eventId) {
        if (!handlersInitialized || !isValidSlot(eventId)) {
            return 0;
        }
        return handlers[eventId].length;
    }

    List<EventRegistration> getRegistrations(int eventId) {
        if (!handlersInitialized || !isValidSlot(eventId)) {
            return Collections.emptyList();
        }
        final HandlerReference[] handlerList = handlers[eventId];
        final String[] names = callbackNames[eventId];
        final List<EventRegistration> registrations = new ArrayList<>(handlerList.length);
        for (int i = 0; i < handlerList.length; i++) {
            registrations.add(new EventRegistration(handlerList[i].get(), names[i]));
        }
        return Collections.unmodifiableList(registrations);
    }

    private static Object[] dereference(HandlerReference[] handlerList) {
        final Object[] referents = new Object[handlerList.length];
        for (int i = 0; i < handlerList.length; i++) {
            referents[i] = handlerList[i].get();
        }
        return referents;
    }

    private static final class HandlerReference extends WeakReference<Object> {
        HandlerReference(Object referent) {
            super(referent);
        }
    }
}
