package com.atrium.auth.oauth;

import com.atrium.auth.config.AtriumAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Shared plumbing for provider clients: the timeout-bounded {@link RestClient},
 * the single-retry policy and JSON field helpers.
 */
@Slf4j
public abstract class AbstractIdentityProviderClient implements IdentityProviderClient {

    protected static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};
    protected static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY =
            new ParameterizedTypeReference<>() {};

    protected final RestClient restClient;
    protected final AtriumAuthProperties.Client client;

    protected AbstractIdentityProviderClient(RestClient restClient, AtriumAuthProperties.Client client) {
        this.restClient = restClient;
        this.client = client;
    }

    @Override
    public boolean isConfigured() {
        return client.isConfigured();
    }

    /**
     * Run one outbound call, retrying exactly once if the first attempt failed
     * at the transport level (connect/read timeout, connection reset).
     * HTTP error statuses are not retried.
     */
    protected <T> T withRetry(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (ResourceAccessException e) {
            log.warn("{} {} failed on transport, retrying once: {}", provider().tag(), operation, e.getMessage());
            return call.get();
        }
    }

    protected static String stringField(Map<String, Object> json, String key) {
        if (json == null) {
            return null;
        }
        Object value = json.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
