package com.trenddigest.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin wrapper over {@link HttpClient} returning response bodies as text.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "TrendDigest/1.0";
    private static final int MAX_BODY_IN_ERROR = 300;

    private final HttpClient client;

    public HttpClientEx() {
        this(Duration.ofSeconds(20));
    }

    public HttpClientEx(Duration connectTimeout) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * @throws HttpStatusException on a non-2xx status
     * @throws IOException on transport failure or timeout
     */
    public String getText(String url, Map<String, String> query, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(withQuery(url, query)))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        // The query may hold an API key; report the bare URL only.
        throw new HttpStatusException(
                resp.statusCode(),
                "HTTP " + resp.statusCode() + " for " + url + " body=" + abbreviate(resp.body())
        );
    }

    static String withQuery(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((key, value) -> joiner.add(
                URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)
        ));
        return url + (url.contains("?") ? "&" : "?") + joiner;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        return trimmed.length() <= MAX_BODY_IN_ERROR ? trimmed : trimmed.substring(0, MAX_BODY_IN_ERROR) + "...";
    }
}
