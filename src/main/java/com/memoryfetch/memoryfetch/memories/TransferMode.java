package com.memoryfetch.memoryfetch.memories;

/**
 * How a locator is fetched.
 */
public enum TransferMode {
    /** Single GET with the routing header. */
    DIRECT,
    /** Form POST of the query string, whose response body is the URL to GET. */
    INDIRECT;

    public static TransferMode fromGetFlag(boolean getRequest) {
        return getRequest ? DIRECT : INDIRECT;
    }
}
