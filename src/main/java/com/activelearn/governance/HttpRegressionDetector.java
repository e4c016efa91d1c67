package com.activelearn.governance;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Asks an external metrics service for canary deltas.
 *
 * <p>Calls {@code GET {endpoint}?agent=...&lookback_hours=...} and expects
 * {@code {"quality_delta": ..., "latency_delta": ...}}.
 */
public class HttpRegressionDetector implements RegressionDetector {
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl endpoint;
    private final String apiKey;

    public HttpRegressionDetector(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = HttpUrl.parse(endpoint);
        if (this.endpoint == null) {
            throw new IllegalArgumentException("Invalid regression endpoint: " + endpoint);
        }
        this.apiKey = apiKey;
    }

    @Override
    public RegressionComparison compare(String agent, int lookbackHours) throws RegressionDetectionException {
        HttpUrl url = endpoint.newBuilder()
                .addQueryParameter("agent", agent)
                .addQueryParameter("lookback_hours", Integer.toString(lookbackHours))
                .build();
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new RegressionDetectionException("Regression service returned HTTP " + response.code() + " for " + agent);
            }
            JsonNode root = mapper.readTree(response.body().string());
            JsonNode quality = root.path("quality_delta");
            JsonNode latency = root.path("latency_delta");
            if (!quality.isNumber() || !latency.isNumber()) {
                throw new RegressionDetectionException("Regression service response for " + agent + " lacks numeric deltas");
            }
            return new RegressionComparison(quality.asDouble(), latency.asDouble());
        } catch (IOException e) {
            throw new RegressionDetectionException("Regression service unreachable for " + agent, e);
        }
    }
}
