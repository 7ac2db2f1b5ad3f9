package no.boreas.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import no.boreas.errors.ApiFormatException;
import no.boreas.errors.NetworkException;
import no.boreas.metrics.UpstreamCallMetrics;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Timed JSON GET requests against one upstream service.
 *
 * <p>
 * Failures are classified: transport errors, timeouts and non-2xx responses
 * become {@link NetworkException}; bodies that are not JSON, or not the shape the
 * caller asked for, become {@link ApiFormatException}. No retry happens here.
 * </p>
 */
public final class FetchClient {
    private static final Logger log = LoggerFactory.getLogger(FetchClient.class);
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final String service;
    private final HttpClient http;
    private final ObjectMapper om;
    private final UpstreamCallMetrics metrics;

    /**
     * Creates a client labelled {@code service} in metrics and log lines.
     */
    public FetchClient(String service, ObjectMapper om, UpstreamCallMetrics metrics) {
        this.service = service;
        this.om = om;
        this.metrics = metrics;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Executes a GET request and parses the response body as JSON.
     */
    public JsonNode fetch(String url, Map<String, String> params, Duration timeout)
            throws NetworkException, ApiFormatException {
        String fullUrl = withQuery(url, params);
        log.debug("{} request -> {}", service, fullUrl);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(fullUrl))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        long t0 = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            metrics.record(service, false, System.currentTimeMillis() - t0);
            throw new NetworkException(service + " request timed out after " + timeout + " url=" + fullUrl, e);
        } catch (IOException e) {
            metrics.record(service, false, System.currentTimeMillis() - t0);
            throw new NetworkException(service + " request failed url=" + fullUrl + " err=" + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.record(service, false, System.currentTimeMillis() - t0);
            throw new NetworkException(service + " request interrupted url=" + fullUrl, e);
        }
        long ms = System.currentTimeMillis() - t0;

        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            metrics.record(service, false, ms);
            throw new NetworkException(service + " request failed: " + code + " url=" + fullUrl
                    + " body=" + abbreviate(resp.body()), code);
        }
        metrics.record(service, true, ms);
        log.debug("{} response {} in {}ms for {}", service, code, ms, fullUrl);

        try {
            return om.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new ApiFormatException(service + " returned a non-JSON body url=" + fullUrl, e);
        }
    }

    /**
     * Fetches a JSON object that must carry the top-level field {@code requiredField}.
     */
    public JsonNode fetchObject(String url, Map<String, String> params, Duration timeout, String requiredField)
            throws NetworkException, ApiFormatException {
        JsonNode root = fetch(url, params, timeout);
        if (root == null || !root.isObject()) {
            throw new ApiFormatException(service + " expected a JSON object url=" + withQuery(url, params));
        }
        if (!root.hasNonNull(requiredField)) {
            throw new ApiFormatException(service + " response is missing '" + requiredField + "' url="
                    + withQuery(url, params));
        }
        return root;
    }

    /**
     * Fetches a payload that must be a JSON array.
     */
    public JsonNode fetchArray(String url, Map<String, String> params, Duration timeout)
            throws NetworkException, ApiFormatException {
        JsonNode root = fetch(url, params, timeout);
        if (root == null || !root.isArray()) {
            throw new ApiFormatException(service + " expected a JSON array url=" + withQuery(url, params));
        }
        return root;
    }

    /**
     * Appends URL-encoded query parameters in insertion order.
     */
    static String withQuery(String url, Map<String, String> params) {
        if (params == null || params.isEmpty())
            return url;
        StringBuilder sb = new StringBuilder(url);
        char sep = url.contains("?") ? '&' : '?';
        for (var e : params.entrySet()) {
            sb.append(sep)
                    .append(enc(e.getKey()))
                    .append('=')
                    .append(enc(e.getValue()));
            sep = '&';
        }
        return sb.toString();
    }

    private static String enc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null)
            return "";
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
