package io.cliphub.hub;

import io.cliphub.connection.Connection;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Everything the dispatcher thread executes. Publishes carry data; the rest are registry mutations
 * and reads routed through the same queue so the store and registry keep a single owner.
 */
sealed interface BusCommand {

    record Publish(BusMessage message) implements BusCommand {
    }

    record Subscribe(Connection connection, List<String> topics,
                     CompletableFuture<List<String>> result) implements BusCommand {
    }

    record Unsubscribe(Connection connection, List<String> topics,
                       CompletableFuture<List<String>> result) implements BusCommand {
    }

    record Disconnect(Connection connection, CompletableFuture<List<String>> result) implements BusCommand {
    }

    record Get(String topic, CompletableFuture<Optional<DataItem>> result) implements BusCommand {
    }

    record Snapshot(CompletableFuture<HubSnapshot> result) implements BusCommand {
    }
}
