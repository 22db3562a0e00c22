package com.openrangelabs.donpetre.mlssync.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP client settings for upstream MLS providers
 */
@Configuration
public class WebClientConfig {

    @Value("${mls.http.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${mls.http.response-timeout:30s}")
    private Duration responseTimeout;

    @Bean
    public WebClientCustomizer providerTimeoutCustomizer() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .responseTimeout(responseTimeout);
        return builder -> builder.clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
