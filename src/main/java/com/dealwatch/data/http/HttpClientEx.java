package com.dealwatch.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Thin wrapper over the JDK HTTP client that returns status and body instead of throwing on
 * non-2xx, so callers can tell a rate-limit reply from other failures.
 */
public class HttpClientEx {
    static final String USER_AGENT = "DealWatch/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public Response get(String url, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        return new Response(resp.statusCode(), resp.body());
    }

    public Response postJson(String url, String json, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json == null ? "" : json))
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        return new Response(resp.statusCode(), resp.body());
    }

    private void applyHeaders(HttpRequest.Builder req, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() == null || header.getValue() == null) {
                continue;
            }
            req.setHeader(header.getKey(), header.getValue());
        }
    }

    public static final class Response {
        public static final int TOO_MANY_REQUESTS = 429;

        public final int statusCode;
        public final String body;

        public Response(int statusCode, String body) {
            this.statusCode = statusCode;
            this.body = body == null ? "" : body;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }

        public boolean isRateLimited() {
            return statusCode == TOO_MANY_REQUESTS;
        }

        /** Short body excerpt for log lines. */
        public String bodySample() {
            String trimmed = body.trim();
            return trimmed.length() > 160 ? trimmed.substring(0, 160) + "..." : trimmed;
        }
    }
}
