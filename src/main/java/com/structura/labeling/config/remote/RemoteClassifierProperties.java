package com.structura.labeling.config.remote;

import com.structura.labeling.util.TimeUtils;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the remote classifier.
 *
 * <p>Properties:
 * <ul>
 *   <li>structura.remote.base-url - OpenAI-compatible API root (default: https://api.openai.com/v1)</li>
 *   <li>structura.remote.api-key - Bearer key; blank makes every call fail with auth_error</li>
 *   <li>structura.remote.model - Model name (default: gpt-4o)</li>
 *   <li>structura.remote.temperature - Sampling temperature (default: 0.0)</li>
 *   <li>structura.remote.base-timeout-s - Response timeout for an empty request (default: 60)</li>
 *   <li>structura.remote.per-paragraph-timeout-s - Timeout added per paragraph (default: 0.5)</li>
 *   <li>structura.remote.max-timeout-s - Upper bound of the response timeout (default: 180)</li>
 *   <li>structura.remote.connect-timeout-s - Fixed connect timeout (default: 10)</li>
 *   <li>structura.remote.max-retry-attempts - Attempts per logical call (default: 3)</li>
 *   <li>structura.remote.backoff-base-s - Delay before the second attempt (default: 1.0)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "structura.remote")
public class RemoteClassifierProperties {

    @NotBlank
    private final String baseUrl;

    private final String apiKey;

    @NotBlank
    private final String model;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @Positive
    private final double baseTimeoutS;

    @PositiveOrZero
    private final double perParagraphTimeoutS;

    @Positive
    private final double maxTimeoutS;

    @Positive
    private final double connectTimeoutS;

    @Positive
    private final int maxRetryAttempts;

    @PositiveOrZero
    private final double backoffBaseS;

    @ConstructorBinding
    public RemoteClassifierProperties(String baseUrl, String apiKey, String model, Double temperature,
                                      Double baseTimeoutS, Double perParagraphTimeoutS, Double maxTimeoutS,
                                      Double connectTimeoutS, Integer maxRetryAttempts, Double backoffBaseS) {
        this.baseUrl = baseUrl == null ? "https://api.openai.com/v1" : baseUrl.trim();
        if (this.baseUrl.isEmpty()) {
            throw new IllegalArgumentException("structura.remote.base-url must not be blank");
        }
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model == null ? "gpt-4o" : model.trim();
        if (this.model.isEmpty()) {
            throw new IllegalArgumentException("structura.remote.model must not be blank");
        }

        double temp = temperature == null ? 0.0 : temperature;
        if (temp < 0.0 || temp > 2.0) {
            throw new IllegalArgumentException("structura.remote.temperature must be in [0,2]");
        }
        this.temperature = temp;

        this.baseTimeoutS = positive(baseTimeoutS, 60.0, "base-timeout-s");
        this.perParagraphTimeoutS = nonNegative(perParagraphTimeoutS, 0.5, "per-paragraph-timeout-s");
        this.maxTimeoutS = positive(maxTimeoutS, 180.0, "max-timeout-s");
        if (this.maxTimeoutS < this.baseTimeoutS) {
            throw new IllegalArgumentException(
                    "structura.remote.max-timeout-s must be >= structura.remote.base-timeout-s");
        }
        this.connectTimeoutS = positive(connectTimeoutS, 10.0, "connect-timeout-s");

        int attempts = maxRetryAttempts == null ? 3 : maxRetryAttempts;
        if (attempts < 1) {
            throw new IllegalArgumentException("structura.remote.max-retry-attempts must be >= 1");
        }
        this.maxRetryAttempts = attempts;
        this.backoffBaseS = nonNegative(backoffBaseS, 1.0, "backoff-base-s");
    }

    private static double positive(Double value, double fallback, String key) {
        double v = value == null ? fallback : value;
        if (!(v > 0.0) || Double.isInfinite(v)) {
            throw new IllegalArgumentException("structura.remote." + key + " must be positive");
        }
        return v;
    }

    private static double nonNegative(Double value, double fallback, String key) {
        double v = value == null ? fallback : value;
        if (!(v >= 0.0) || Double.isInfinite(v)) {
            throw new IllegalArgumentException("structura.remote." + key + " must not be negative");
        }
        return v;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getBaseTimeoutS() {
        return baseTimeoutS;
    }

    public double getPerParagraphTimeoutS() {
        return perParagraphTimeoutS;
    }

    public double getMaxTimeoutS() {
        return maxTimeoutS;
    }

    public double getConnectTimeoutS() {
        return connectTimeoutS;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public double getBackoffBaseS() {
        return backoffBaseS;
    }

    public Duration baseTimeout() {
        return TimeUtils.secondsToDuration(baseTimeoutS);
    }

    public Duration perParagraphTimeout() {
        return TimeUtils.secondsToDuration(perParagraphTimeoutS);
    }

    public Duration maxTimeout() {
        return TimeUtils.secondsToDuration(maxTimeoutS);
    }

    public Duration connectTimeout() {
        return TimeUtils.secondsToDuration(connectTimeoutS);
    }

    public Duration backoffBase() {
        return TimeUtils.secondsToDuration(backoffBaseS);
    }

    @Override
    public String toString() {
        // never print the key
        return "RemoteClassifierProperties{baseUrl=" + baseUrl + ", model=" + model
                + ", apiKeySet=" + hasApiKey() + ", baseTimeoutS=" + baseTimeoutS
                + ", perParagraphTimeoutS=" + perParagraphTimeoutS + ", maxTimeoutS=" + maxTimeoutS
                + ", connectTimeoutS=" + connectTimeoutS + ", maxRetryAttempts=" + maxRetryAttempts
                + ", backoffBaseS=" + backoffBaseS + "}";
    }
}
