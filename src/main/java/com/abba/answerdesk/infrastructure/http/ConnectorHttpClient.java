package com.abba.answerdesk.infrastructure.http;

import com.abba.answerdesk.domain.exception.AuthenticationException;
import com.abba.answerdesk.domain.exception.ConnectorException;
import com.abba.answerdesk.domain.exception.TransientProviderException;
import com.abba.answerdesk.infrastructure.config.ConnectorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class ConnectorHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ConnectorHttpClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String platform;
    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final Retry retry;

    public ConnectorHttpClient(String platform, OkHttpClient client, ObjectMapper objectMapper, ConnectorProperties properties) {
        this.platform = platform;
        this.client = client;
        this.objectMapper = objectMapper;
        long baseDelayMillis = Math.max(1, properties.getRetryBaseDelay().toMillis());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getRetryAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelayMillis, 2))
                .retryExceptions(TransientProviderException.class)
                .build();
        this.retry = Retry.of(platform + "-http", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.info("Retrying {} request attempt={} reason={}", platform,
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    public JsonNode get(String url, String bearerToken) {
        Request.Builder builder = new Request.Builder().url(url).get();
        authorize(builder, bearerToken);
        return execute(builder.build());
    }

    public JsonNode postJson(String url, String bearerToken, Object payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ConnectorException(platform, "Unable to serialize request payload", e);
        }
        Request.Builder builder = new Request.Builder().url(url).post(RequestBody.create(body, JSON));
        authorize(builder, bearerToken);
        return execute(builder.build());
    }

    public JsonNode execute(Request request) {
        return Retry.decorateSupplier(retry, () -> executeOnce(request)).get();
    }

    private JsonNode executeOnce(Request request) {
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            int code = response.code();
            if (code == 401 || code == 403) {
                throw new AuthenticationException(platform, "Credentials rejected. status=" + code);
            }
            if (code == 429 || code >= 500) {
                throw new TransientProviderException(platform, "Provider unavailable. status=" + code);
            }
            if (!response.isSuccessful()) {
                throw new ConnectorException(platform, "Request failed. status=" + code);
            }
            return body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ConnectorException(platform, "Malformed response body", e);
        } catch (IOException e) {
            throw new TransientProviderException(platform, "I/O error: " + e.getMessage(), e);
        }
    }

    private void authorize(Request.Builder builder, String bearerToken) {
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.addHeader("Authorization", "Bearer " + bearerToken);
        }
    }
}
