package io.cliphub.upstream;

import lombok.Getter;

import java.net.URI;
import java.util.List;

/**
 * Observable state of the link to a peer hub.
 */
@Getter
public final class UpstreamLink {

    private final URI url;
    private final List<String> topics;
    private volatile boolean connected;
    private volatile String connectedSince;

    public UpstreamLink(final URI url, final List<String> topics) {
        this.url = url;
        this.topics = List.copyOf(topics);
    }

    void markConnected(final String ts) {
        connectedSince = ts;
        connected = true;
    }

    void markDisconnected() {
        connected = false;
        connectedSince = null;
    }
}
