package com.coursecast.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Shared JSON-over-HTTP plumbing for the collaborator clients.
 *
 * Uses java.net.http.HttpClient directly so every header and byte on the
 * wire is explicit. Failures come out as {@link CollaboratorException},
 * already classified transient or permanent.
 */
abstract class JsonHttpClient {

    protected final HttpClient   http;
    protected final ObjectMapper json;

    protected JsonHttpClient(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** POST a JSON body and return the response body; non-2xx becomes a CollaboratorException. */
    protected String postJson(String url, Object body, Duration timeout, String opName) {
        String requestBody = toJson(body);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                throw new CollaboratorException(
                        opName + " failed: HTTP " + status + ": " + abbreviate(resp.body()),
                        CollaboratorException.isTransientStatus(status), status, null);
            }
            return resp.body();
        } catch (HttpTimeoutException e) {
            throw new CollaboratorException(opName + " timed out after " + timeout, true, e);
        } catch (IOException e) {
            throw new CollaboratorException(opName + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(opName + " interrupted", true, e);
        }
    }

    protected <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Failed to parse " + opName + " response", false, e);
        }
    }

    protected String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("JSON serialization failed", false, e);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 500 ? s : s.substring(0, 500) + "...";
    }
}
