package io.cliphub.transport.impl;

import org.json.JSONObject;

/**
 * Transport-neutral HTTP reply.
 */
public record RestResponse(int status, String contentType, String body) {

    public static final String JSON = "application/json";
    public static final String TEXT = "text/plain; charset=utf-8";

    public static RestResponse json(final int status, final JSONObject body) {
        return new RestResponse(status, JSON, body.toString());
    }

    public static RestResponse text(final int status, final String body) {
        return new RestResponse(status, TEXT, body);
    }

    public static RestResponse empty(final int status) {
        return new RestResponse(status, TEXT, "");
    }
}
