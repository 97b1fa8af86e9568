package io.xqueue;

/**
 * Body encoding used when posting results to the origin callback.
 */
public enum CallbackEncoding {
    /** {@code application/json} object with {@code xqueue_header} and {@code xqueue_body}. */
    JSON,
    /** {@code application/x-www-form-urlencoded} fields with the same names. */
    FORM
}
