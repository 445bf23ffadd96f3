package com.geniebridge.relay.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class GenieClientConfig {

  @Bean
  public WebClient genieWebClient(GenieProperties properties) {
    Duration timeout = properties.timeout();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(timeout.toMillis()))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(
                        new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));
    return WebClient.builder()
        .baseUrl(normalizeHost(properties.host()))
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }

  static String normalizeHost(String host) {
    String out = host.trim();
    if (!out.startsWith("http://") && !out.startsWith("https://")) {
      out = "https://" + out;
    }
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }
}
