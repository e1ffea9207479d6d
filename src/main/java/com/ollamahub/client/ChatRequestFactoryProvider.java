package com.ollamahub.client;

import org.springframework.http.client.ClientHttpRequestFactory;

import java.time.Duration;

/**
 * Supplies the request factory used for one endpoint, with the socket read bounded by the
 * calling agent's own timeout.
 */
@FunctionalInterface
public interface ChatRequestFactoryProvider {

    ClientHttpRequestFactory forReadTimeout(Duration readTimeout);
}
