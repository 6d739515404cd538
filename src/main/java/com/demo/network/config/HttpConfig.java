package com.demo.network.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpConfig {

    @Bean
    @Primary
    public RestTemplate restTemplate(@Value("${http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${http.read-timeout-ms:8000}") int readTimeoutMs) {
        return build(connectTimeoutMs, readTimeoutMs);
    }

    /** Summarizer calls get their own, shorter read timeout. */
    @Bean
    public RestTemplate narrativeRestTemplate(@Value("${http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                              NetworkProperties properties) {
        return build(connectTimeoutMs, (int) properties.getNarrative().getTimeoutMs());
    }

    static RestTemplate build(int connectTimeoutMs, int readTimeoutMs) {
        CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig(connectTimeoutMs, readTimeoutMs))
                        .build())
                .setDefaultRequestConfig(requestConfig(readTimeoutMs))
                .build();
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(client));
    }

    static ConnectionConfig connectionConfig(int connectTimeoutMs, int readTimeoutMs) {
        return ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();
    }

    // response timeout bounds the wait for the first byte of each request
    static RequestConfig requestConfig(int readTimeoutMs) {
        return RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();
    }
}
