package com.pricecheck.checker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecheck.checker.adapter.BrowserSearchFallback;
import com.pricecheck.checker.adapter.WoolworthsAdapter;
import com.pricecheck.checker.client.RetryingRequestExecutor;
import com.pricecheck.checker.client.RetrySettings;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outbound HTTP for retailer sources. Retries are not done here: the
 * {@link RetryingRequestExecutor} owns classification and backoff.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    @Value("${price-check.http.connect-timeout:PT10S}")
    private Duration connectTimeout;

    @Value("${price-check.retry.request-timeout:PT4S}")
    private Duration requestTimeout;

    @Value("${price-check.sources.woolworths.base-url:https://www.woolworths.com.au}")
    private String woolworthsBaseUrl;

    @Bean
    public WebClient sourceWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .responseTimeout(requestTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(requestTimeout.toSeconds(), TimeUnit.SECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public RetryingRequestExecutor retryingRequestExecutor(WebClient sourceWebClient, ObjectMapper objectMapper,
                                                           RetrySettings retrySettings) {
        return new RetryingRequestExecutor(sourceWebClient, objectMapper, retrySettings);
    }

    @Bean
    public WoolworthsAdapter woolworthsAdapter(RetryingRequestExecutor retryingRequestExecutor,
                                               ObjectProvider<BrowserSearchFallback> browserFallbacks) {
        BrowserSearchFallback fallback = browserFallbacks.orderedStream()
            .filter(f -> WoolworthsAdapter.SOURCE_NAME.equals(f.sourceName()))
            .findFirst()
            .orElse(null);
        return new WoolworthsAdapter(retryingRequestExecutor, woolworthsBaseUrl, fallback);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
