package com.ivamare.requestqueue.model;

/**
 * Where a request was issued from.
 */
public enum RequestOrigin {
    /** Issued by a caller that waits for the response; never persisted */
    INTERACTIVE,

    /** Read from the persisted request queue; has no waiting caller */
    QUEUED
}
