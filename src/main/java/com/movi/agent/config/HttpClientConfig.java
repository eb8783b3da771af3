package com.movi.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient for the reasoning gateway.
 *
 * Connect and socket timeouts are bounded so a stuck provider surfaces as a
 * turn failure instead of holding the thread's lock indefinitely.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${llm.read-timeout-ms:60000}")
    private long readTimeoutMs;

    @Bean("gatewayRestClientBuilder")
    public RestClient.Builder gatewayRestClientBuilder() {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .build())
                .build();

        log.info("Gateway HttpClient configured [connectTimeout={}ms, readTimeout={}ms]",
                connectTimeoutMs, readTimeoutMs);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
