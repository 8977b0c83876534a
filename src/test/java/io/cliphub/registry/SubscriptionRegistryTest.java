package io.cliphub.registry;

import io.cliphub.connection.Connection;
import io.cliphub.testing.RecordingSink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriptionRegistryTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final Connection a = new Connection(1, new RecordingSink(), 4);
    private final Connection b = new Connection(2, new RecordingSink(), 4);

    @Test
    void subscribeReportsOnlyNewTopics() {
        assertEquals(List.of("c", "p"), registry.subscribe(a, List.of("c", "p")));
        assertEquals(List.of("s"), registry.subscribe(a, List.of("c", "s")));
        assertEquals(List.of("c", "p", "s"), registry.topics());
        assertEquals(Set.of(a), registry.subscribers("s"));
    }

    @Test
    void unsubscribeReportsOnlyRemovedTopics() {
        registry.subscribe(a, List.of("c"));

        assertEquals(List.of("c"), registry.unsubscribe(a, List.of("c", "p")));
        assertEquals(List.of(), registry.unsubscribe(a, List.of("c")));
    }

    @Test
    void emptyTopicsAreRemoved() {
        registry.subscribe(a, List.of("c"));
        registry.subscribe(b, List.of("c"));

        registry.unsubscribe(a, List.of("c"));
        assertEquals(List.of("c"), registry.topics());

        registry.unsubscribe(b, List.of("c"));
        assertEquals(List.of(), registry.topics());
        assertTrue(registry.subscribers("c").isEmpty());
    }

    @Test
    void dropConnectionLeavesOthersAlone() {
        registry.subscribe(a, List.of("c", "p"));
        registry.subscribe(b, List.of("p"));

        assertEquals(List.of("c", "p"), registry.dropConnection(a));

        assertEquals(Set.of(b), registry.subscribers("p"));
        assertEquals(List.of("p"), registry.topics());
        assertEquals(1, registry.connectionCount());
        assertEquals(List.of(), registry.dropConnection(a));
    }

    @Test
    void countsSubscriptionsAcrossTopics() {
        registry.subscribe(a, List.of("c", "p"));
        registry.subscribe(b, List.of("p"));

        assertEquals(3, registry.subscriptionCount());
        assertEquals(2, registry.connectionCount());
    }
}
