package com.dixonrepair.vinsearch.configuration;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.config.VinDecodeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient instances for the external collaborators.
 *
 * <p>Response timeouts here are a transport-level safety net; the per-call
 * timeout that drives retries is applied by the search executor.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient tavilyWebClient(SearchProperties props) {
        return build(props.getTavily().getBaseUrl(), props.getProviderTimeoutMs());
    }

    @Bean
    public WebClient serperWebClient(SearchProperties props) {
        return WebClient.builder()
                .baseUrl(props.getSerper().getBaseUrl())
                .defaultHeader("X-API-KEY", props.getSerper().getApiKey() == null ? "" : props.getSerper().getApiKey())
                .clientConnector(connector(props.getProviderTimeoutMs()))
                .exchangeStrategies(strategies())
                .build();
    }

    @Bean
    public WebClient nhtsaWebClient(VinDecodeProperties props) {
        return build(props.getBaseUrl(), props.getTimeoutMs());
    }

    private WebClient build(String baseUrl, long timeoutMs) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(connector(timeoutMs))
                .exchangeStrategies(strategies())
                .build();
    }

    private ReactorClientHttpConnector connector(long timeoutMs) {
        return new ReactorClientHttpConnector(HttpClient.create().responseTimeout(Duration.ofMillis(timeoutMs)));
    }

    private ExchangeStrategies strategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
