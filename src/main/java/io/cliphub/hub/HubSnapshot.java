package io.cliphub.hub;

import java.util.List;

/**
 * Point-in-time view of dispatcher-owned state, taken on the dispatcher thread.
 *
 * @param topics         topics with at least one subscriber, sorted
 * @param subscriptions  sum of subscriber-set sizes
 * @param connections    connections holding at least one subscription
 * @param storedTopics   topics with a stored value
 * @param processed      bus messages processed so far
 * @param malformedItems items skipped for lacking a topic
 */
public record HubSnapshot(List<String> topics,
                          int subscriptions,
                          int connections,
                          int storedTopics,
                          long processed,
                          long malformedItems) {
}
