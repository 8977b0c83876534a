package io.cliphub.hub;

import io.cliphub.core.model.BusMessage;

/**
 * Producer side of the bus, as seen by background components.
 */
@FunctionalInterface
public interface BusPublisher {
    void submit(BusMessage message) throws InterruptedException;
}
