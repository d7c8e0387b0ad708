package com.github.jocull.slotevents.lib.event;

/**
 * Marks handlers whose lifetime can end while other objects still hold references to them.
 */
public interface Destroyable {
    boolean isDestroyed();
}
