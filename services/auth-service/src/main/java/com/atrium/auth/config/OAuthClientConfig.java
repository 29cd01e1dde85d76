package com.atrium.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Outbound HTTP client for identity-provider calls, with bounded connect and
 * read timeouts so no callback can hang on a slow provider.
 */
@Configuration
public class OAuthClientConfig {

    @Bean
    public RestClient oauthRestClient(RestClient.Builder builder, AtriumAuthProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getOauth().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getOauth().getReadTimeout().toMillis());
        return builder.requestFactory(requestFactory).build();
    }
}
