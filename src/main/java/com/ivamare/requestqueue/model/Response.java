package com.ivamare.requestqueue.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Response to a request.
 *
 * <p>The transport's response shape is opaque beyond the {@code jsonCode};
 * any other fields are carried in {@code body}.
 *
 * @param jsonCode Status code, see {@link JsonCode}
 * @param body Remaining response fields (never null)
 */
public record Response(
    int jsonCode,
    Map<String, Object> body
) {
    private static final Response OFFLINE = new Response(JsonCode.OFFLINE, Map.of());

    public Response {
        // Transports may return null field values, which Map.copyOf rejects
        body = body != null ? Collections.unmodifiableMap(new HashMap<>(body)) : Map.of();
    }

    /**
     * Synthetic response handed to interactive callers whose request failed.
     *
     * @return the offline sentinel
     */
    public static Response offline() {
        return OFFLINE;
    }

    public static Response success(Map<String, Object> body) {
        return new Response(JsonCode.SUCCESS, body);
    }

    public boolean isOffline() {
        return jsonCode == JsonCode.OFFLINE;
    }
}
