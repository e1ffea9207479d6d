package com.ollamahub.config;

import com.ollamahub.client.ChatRequestFactoryProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    /**
     * One shared JDK {@link HttpClient}; each endpoint gets its own factory so the read timeout
     * matches the agent's timeout. The JDK client aborts the exchange when the calling thread is
     * interrupted.
     */
    @Bean
    public ChatRequestFactoryProvider chatRequestFactoryProvider(HubProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .build();
        log.debug("HTTP client configured. connectTimeout={}.", properties.getHttp().getConnectTimeout());
        return readTimeout -> {
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(readTimeout);
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            return new BufferingClientHttpRequestFactory(requestFactory);
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.ollamahub.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            long startedAt = System.nanoTime();
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(request, response, (System.nanoTime() - startedAt) / 1_000_000);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0 && httpLogger.isTraceEnabled()) {
                httpLogger.trace("Request body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(HttpRequest request, ClientHttpResponse response, long elapsedMillis) throws IOException {
            String status;
            try {
                status = response.getStatusCode().toString();
            } catch (IOException e) {
                status = "unknown";
            }
            httpLogger.debug("<-- {} {} ({} ms)", status, request.getURI(), elapsedMillis);
            if (httpLogger.isTraceEnabled()) {
                byte[] body = StreamUtils.copyToByteArray(response.getBody());
                if (body.length > 0) {
                    httpLogger.trace("Response body: {}", new String(body, StandardCharsets.UTF_8));
                }
            }
        }
    }
}
