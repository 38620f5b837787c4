package com.opro.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Outbound model-provider traffic. Bodies are only logged when {@code com.opro.http.logging} is at DEBUG.
 */
@Configuration
public class RestClientConfig {

    private static final List<String> REDACTED_HEADERS = List.of(HttpHeaders.AUTHORIZATION, "x-goog-api-key");

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.opro.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // OpenAI-compatible gateways without auth expect an empty bearer token
            var headers = request.getHeaders();
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.set(HttpHeaders.AUTHORIZATION, "");
                }
            }

            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--> {} {} headers={}", request.getMethod(), request.getURI(), redact(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("--> body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            try {
                httpLogger.debug("<-- status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("<-- status: unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("<-- body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private HttpHeaders redact(HttpHeaders source) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(source);
            for (String name : REDACTED_HEADERS) {
                if (copy.containsKey(name)) {
                    copy.set(name, "***");
                }
            }
            return copy;
        }
    }
}
