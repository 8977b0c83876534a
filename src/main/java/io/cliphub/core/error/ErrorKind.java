package io.cliphub.core.error;

/**
 * Closed taxonomy of failures the hub reports as values instead of exceptions.
 */
public enum ErrorKind {
    /** Malformed publish input or request parameters. */
    VALIDATION,
    /** Unknown topic on fetch/get. */
    NOT_FOUND,
    UNKNOWN_TYPE,
    UNKNOWN_ACTION,
    UNKNOWN_METHOD,
    /** Bus full; the request was not accepted. */
    OVERLOADED,
    /** Connection dropped or upstream unreachable. */
    TRANSPORT,
    /** Selection buffer command exceeded its deadline. */
    EXTERNAL_TOOL_TIMEOUT,
    /** Selection tool missing or not executable. */
    EXTERNAL_TOOL_UNAVAILABLE
}
