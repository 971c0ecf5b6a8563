package com.ivamare.requestqueue.model;

/**
 * Well-known values of the {@code jsonCode} field of a {@link Response}.
 */
public final class JsonCode {

    private JsonCode() {
    }

    public static final int SUCCESS = 200;

    /** No response was obtained from the server. */
    public static final int OFFLINE = 0;
}
