package com.memoryfetch.memoryfetch.memories;

import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * {@link MemoryTransport} over a shared {@link RestClient}. The client only carries read-only defaults;
 * per-request headers are applied to each request.
 */
@Component
public class RestClientMemoryTransport implements MemoryTransport {

    private final RestClient restClient;

    public RestClientMemoryTransport(RestClient memoriesRestClient) {
        this.restClient = memoriesRestClient;
    }

    @Override
    public long get(String url, Map<String, String> headers, Path destination) {
        URI uri = toUri(url);
        try {
            Long written = restClient.get()
                    .uri(uri)
                    .headers(httpHeaders -> headers.forEach(httpHeaders::set))
                    .exchange((request, response) -> {
                        ensureSuccess(HttpMethod.GET, uri, response.getStatusCode());
                        try (InputStream body = response.getBody()) {
                            return Files.copy(body, destination, StandardCopyOption.REPLACE_EXISTING);
                        }
                    });
            return written == null ? 0L : written;
        } catch (RestClientException | IllegalArgumentException ex) {
            throw new MemoryTransferException("GET " + uri + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String postForm(String url, String formBody) {
        URI uri = toUri(url);
        try {
            return restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(formBody == null ? "" : formBody)
                    .exchange((request, response) -> {
                        ensureSuccess(HttpMethod.POST, uri, response.getStatusCode());
                        String text = response.bodyTo(String.class);
                        return text == null ? "" : text;
                    });
        } catch (RestClientException | IllegalArgumentException ex) {
            throw new MemoryTransferException("POST " + uri + " failed: " + ex.getMessage(), ex);
        }
    }

    private static void ensureSuccess(HttpMethod method, URI uri, HttpStatusCode status) {
        if (!status.is2xxSuccessful()) {
            throw new MemoryTransferException(
                    MemoriesConstants.MSG_HTTP_STATUS.formatted(method, uri, status.value()));
        }
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new MemoryTransferException(MemoriesConstants.MSG_INVALID_URL.formatted(url), ex);
        }
    }
}
