package com.demo.network.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpConfig")
class HttpConfigTest {

    private final HttpConfig config = new HttpConfig();

    @Test
    @DisplayName("rest templates are backed by Apache HttpClient")
    void pooledFactory() {
        RestTemplate template = config.restTemplate(5000, 8000);

        assertInstanceOf(HttpComponentsClientHttpRequestFactory.class, template.getRequestFactory());
    }

    @Test
    @DisplayName("connect and read timeouts land on the connection config")
    void connectionTimeouts() {
        ConnectionConfig connection = HttpConfig.connectionConfig(5000, 8000);

        assertEquals(5000, connection.getConnectTimeout().toMilliseconds());
        assertEquals(8000, connection.getSocketTimeout().toMilliseconds());
    }

    @Test
    @DisplayName("read timeout also bounds the response wait")
    void responseTimeout() {
        assertEquals(8000, HttpConfig.requestConfig(8000).getResponseTimeout().toMilliseconds());
    }

    @Test
    @DisplayName("summarizer template is built from the narrative timeout")
    void narrativeTemplate() {
        NetworkProperties properties = new NetworkProperties();
        properties.getNarrative().setTimeoutMs(1500);

        RestTemplate template = config.narrativeRestTemplate(5000, properties);

        assertInstanceOf(HttpComponentsClientHttpRequestFactory.class, template.getRequestFactory());
    }
}
