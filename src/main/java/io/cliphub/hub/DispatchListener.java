package io.cliphub.hub;

import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;

/**
 * Hooks invoked by the dispatcher after a bus message has been applied. Called on the dispatcher
 * thread, so implementations hand work off rather than block. Exceptions are logged and dropped.
 */
public interface DispatchListener {

    /**
     * Once per item of the message, in order.
     */
    default void onItemApplied(final DataItem item) {
    }

    /**
     * Once per message, after every item hook has run.
     */
    default void onMessageApplied(final BusMessage message) {
    }
}
