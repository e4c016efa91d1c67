package com.activelearn.governance;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import com.activelearn.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class RegressionDetectors {
    static final String URL_ENV = "AL_REGRESSION_URL";
    static final String API_KEY_ENV = "AL_REGRESSION_API_KEY";

    private RegressionDetectors() {
    }

    public static RegressionDetector fromEnvironment(AppConfig config) {
        return fromConfig(config, System.getenv());
    }

    public static RegressionDetector fromConfig(AppConfig config, Map<String, String> env) {
        AppConfig.RegressionConfig regression = config.getRegression();
        String url = env.getOrDefault(URL_ENV, regression.getUrl());
        if (url != null && !url.isBlank() && (env.containsKey(URL_ENV) || "http".equalsIgnoreCase(regression.getProvider()))) {
            String apiKey = env.getOrDefault(API_KEY_ENV, regression.getApiKey());
            OkHttpClient httpClient = new OkHttpClient.Builder()
                    .callTimeout(Duration.ofMillis(regression.getTimeoutMs()))
                    .build();
            return new HttpRegressionDetector(httpClient, url, apiKey);
        }
        RunMetricsSource source = new JsonLinesRunMetricsSource(Path.of(config.getStorage().getRunMetricsPath()));
        return new RunMetricsRegressionDetector(source, regression.getMinSamples());
    }
}
