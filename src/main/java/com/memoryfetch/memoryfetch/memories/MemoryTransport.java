package com.memoryfetch.memoryfetch.memories;

import java.nio.file.Path;
import java.util.Map;

/**
 * HTTP operations the transfer protocols are built from.
 * Implementations throw {@link MemoryTransferException} for non-2xx responses and I/O failures.
 */
public interface MemoryTransport {

    /**
     * GETs {@code url} with the given extra headers and streams the body into {@code destination},
     * replacing any existing file.
     *
     * @return number of bytes written
     */
    long get(String url, Map<String, String> headers, Path destination);

    /**
     * POSTs {@code formBody} as {@code application/x-www-form-urlencoded} and returns the response body text.
     */
    String postForm(String url, String formBody);
}
