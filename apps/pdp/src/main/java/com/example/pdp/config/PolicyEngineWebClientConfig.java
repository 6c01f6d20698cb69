package com.example.pdp.config;

import com.example.pdp.config.properties.PolicyEngineProperties;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient for the local policy engine.
 *
 * The engine runs next to the sidecar, so the pool is small and timeouts are short.
 * The per-query timeout is applied by {@link com.example.pdp.engine.PolicyEngineClient}.
 */
@Configuration
public class PolicyEngineWebClientConfig {

    /**
     * Bean qualifier for the policy engine WebClient.
     */
    public static final String POLICY_ENGINE_WEBCLIENT = "policyEngineWebClient";

    @Bean(POLICY_ENGINE_WEBCLIENT)
    public WebClient policyEngineWebClient(
            WebClient.Builder webClientBuilder,
            PolicyEngineProperties properties) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("policy-engine-pool")
                .maxConnections(200)
                .pendingAcquireMaxCount(1000)
                .pendingAcquireTimeout(properties.timeout())
                .maxIdleTime(Duration.ofSeconds(30))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis())
                .responseTimeout(properties.timeout())
                .keepAlive(true);

        WebClient.Builder builder = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(properties.url())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        if (properties.hasToken()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token());
        }
        return builder.build();
    }
}
