package io.cliphub.core.model;

/**
 * Originator of a {@link BusMessage}: a local connection, the upstream bridge, or nobody in particular.
 */
public interface Source {

    Source NONE = Origin.NONE;
    Source UPSTREAM = Origin.UPSTREAM;

    enum Origin implements Source {
        NONE,
        UPSTREAM
    }
}
