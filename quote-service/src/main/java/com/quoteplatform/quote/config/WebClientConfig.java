package com.quoteplatform.quote.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client settings applied to the auto-configured {@code WebClient.Builder}. Each provider
 * clones that builder and sets its own base URL. The per-attempt deadline is enforced by the
 * aggregator; the socket timeouts here are only a backstop.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Bean
    public ReactorClientHttpConnector quoteHttpConnector() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(15))
            .followRedirect(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    @Bean
    public WebClientCustomizer quoteWebClientCustomizer(ReactorClientHttpConnector quoteHttpConnector) {
        return builder -> builder
            .clientConnector(quoteHttpConnector)
            .defaultHeader("User-Agent", "quote-platform/1.0")
            .filter(loggingFilter());
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
