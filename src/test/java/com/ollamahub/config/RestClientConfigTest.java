package com.ollamahub.config;

import com.ollamahub.client.ChatRequestFactoryProvider;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestFactory;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RestClientConfigTest {

    @Test
    void testProviderBuildsSeparateFactoryPerTimeout() {
        ChatRequestFactoryProvider provider = new RestClientConfig().chatRequestFactoryProvider(new HubProperties());

        ClientHttpRequestFactory fast = provider.forReadTimeout(Duration.ofSeconds(5));
        ClientHttpRequestFactory slow = provider.forReadTimeout(Duration.ofSeconds(180));

        assertInstanceOf(BufferingClientHttpRequestFactory.class, fast);
        assertNotSame(fast, slow);
    }
}
