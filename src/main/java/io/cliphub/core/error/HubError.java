package io.cliphub.core.error;

import java.util.Objects;

public record HubError(ErrorKind kind, String message) {

    public HubError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static HubError validation(final String message) {
        return new HubError(ErrorKind.VALIDATION, message);
    }

    public static HubError notFound(final String topic) {
        return new HubError(ErrorKind.NOT_FOUND, "topic '" + topic + "' not found");
    }

    public static HubError overloaded() {
        return new HubError(ErrorKind.OVERLOADED, "hub is busy, retry later");
    }

    public static HubError of(final ErrorKind kind, final String message) {
        return new HubError(kind, message);
    }
}
