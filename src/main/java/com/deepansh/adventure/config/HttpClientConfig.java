package com.deepansh.adventure.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient used to reach the game engine sidecar.
 *
 * The engine runs a Z-machine interpreter per environment, so a single step
 * can take a while on the first call (story file load). The read timeout is
 * the only bound on a hanging engine call; there is no other cancellation.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder engineRestClientBuilder(GameProperties gameProperties) {
        GameProperties.Engine engine = gameProperties.getEngine();

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(engine.getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(engine.getReadTimeoutMs()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .build())
                .build();

        HttpComponentsClientHttpRequestFactory factory =
                new HttpComponentsClientHttpRequestFactory(httpClient);

        log.info("Engine HttpClient configured [baseUrl={}, connectTimeout={}ms, readTimeout={}ms]",
                engine.getBaseUrl(), engine.getConnectTimeoutMs(), engine.getReadTimeoutMs());

        return RestClient.builder()
                .requestFactory(factory)
                .baseUrl(engine.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
    }
}
