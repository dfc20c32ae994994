package com.memoryfetch.memoryfetch.memories;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

/**
 * In-memory transport for tests. Unknown or failing URLs answer like an HTTP 500.
 */
class FakeMemoryTransport implements MemoryTransport {

    private final Map<String, Deque<byte[]>> getResponses = new ConcurrentHashMap<>();
    private final Map<String, String> postResponses = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, RuntimeException> errors = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, String>> getHeaders = Collections.synchronizedList(new ArrayList<>());

    private volatile CountDownLatch blockGets;
    private volatile CountDownLatch startedGets;

    FakeMemoryTransport respond(String url, byte[]... bodies) {
        getResponses.put(url, new ArrayDeque<>(List.of(bodies)));
        return this;
    }

    FakeMemoryTransport respondToPost(String url, String body) {
        postResponses.put(url, body);
        return this;
    }

    FakeMemoryTransport fail(String url) {
        failing.add(url);
        return this;
    }

    /**
     * Makes every GET of {@code url} throw {@code error} as is.
     */
    FakeMemoryTransport raise(String url, RuntimeException error) {
        errors.put(url, error);
        return this;
    }

    /**
     * Makes every GET block until interrupted; {@code started} counts down as GETs arrive.
     */
    FakeMemoryTransport blockGets(CountDownLatch started) {
        this.blockGets = new CountDownLatch(1);
        this.startedGets = started;
        return this;
    }

    List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    List<Map<String, String>> getHeaders() {
        synchronized (getHeaders) {
            return List.copyOf(getHeaders);
        }
    }

    long count(String prefix) {
        return calls().stream().filter(call -> call.startsWith(prefix)).count();
    }

    @Override
    public long get(String url, Map<String, String> headers, Path destination) {
        calls.add("GET " + url);
        getHeaders.add(Map.copyOf(headers));

        CountDownLatch block = blockGets;
        if (block != null) {
            startedGets.countDown();
            try {
                block.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new MemoryTransferException("GET " + url + " interrupted", ex);
            }
        }

        RuntimeException error = errors.get(url);
        if (error != null) {
            throw error;
        }

        byte[] body = nextBody(url);
        if (body == null) {
            throw new MemoryTransferException(MemoriesConstants.MSG_HTTP_STATUS.formatted("GET", url, 500));
        }
        try {
            Files.write(destination, body);
        } catch (IOException ex) {
            throw new MemoryTransferException("write failed", ex);
        }
        return body.length;
    }

    @Override
    public String postForm(String url, String formBody) {
        calls.add("POST " + url + " " + formBody);
        String response = postResponses.get(url);
        if (response == null || failing.contains(url)) {
            throw new MemoryTransferException(MemoriesConstants.MSG_HTTP_STATUS.formatted("POST", url, 500));
        }
        return response;
    }

    private byte[] nextBody(String url) {
        if (failing.contains(url)) {
            return null;
        }
        Deque<byte[]> bodies = getResponses.get(url);
        if (bodies == null) {
            return null;
        }
        synchronized (bodies) {
            return bodies.size() > 1 ? bodies.poll() : bodies.peek();
        }
    }
}
