package com.liferx.brain.config;

import com.liferx.brain.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient used for model calls.
 *
 * The socket timeout bounds the gap between streamed bytes, not the whole
 * response: a long answer that keeps streaming is never cut off.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("modelRestClientBuilder")
    public RestClient.Builder modelRestClientBuilder(LlmProperties props) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(props.getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(props.getReadTimeoutMs()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .setMaxConnTotal(50)
                                .setMaxConnPerRoute(20)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(props.getReadTimeoutMs()))
                        .build())
                .build();

        log.info("Model HttpClient configured [connectTimeout={}ms, readTimeout={}ms]",
                props.getConnectTimeoutMs(), props.getReadTimeoutMs());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
