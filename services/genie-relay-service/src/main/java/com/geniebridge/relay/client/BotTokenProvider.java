package com.geniebridge.relay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geniebridge.relay.config.BotProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Client-credentials token for outbound Bot Connector calls, cached until shortly before it
 * expires. Empty when no app id is configured (emulator).
 */
@Service
@Slf4j
public class BotTokenProvider {

  private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);

  private final RestClient rest;
  private final BotProperties properties;
  private volatile CachedToken cached;

  public BotTokenProvider(RestClient.Builder builder, BotProperties properties) {
    this.rest = builder.build();
    this.properties = properties;
  }

  public Optional<String> token() {
    if (!properties.isAuthEnabled()) {
      return Optional.empty();
    }
    CachedToken current = cached;
    if (current != null && current.expiresAt().isAfter(Instant.now())) {
      return Optional.of(current.value());
    }
    synchronized (this) {
      if (cached == null || !cached.expiresAt().isAfter(Instant.now())) {
        cached = fetch();
      }
      return Optional.of(cached.value());
    }
  }

  private CachedToken fetch() {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "client_credentials");
    form.add("client_id", properties.appId());
    form.add("client_secret", properties.appPassword());
    form.add("scope", properties.tokenScope());
    JsonNode body =
        rest.post()
            .uri(properties.tokenUrl())
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .body(JsonNode.class);
    String token = body == null ? "" : body.path("access_token").asText("");
    if (token.isBlank()) {
      throw new IllegalStateException("Bot token endpoint returned no access_token");
    }
    long expiresIn = body.path("expires_in").asLong(3600);
    Duration lifetime = Duration.ofSeconds(expiresIn).minus(EXPIRY_MARGIN);
    if (lifetime.isNegative()) {
      lifetime = Duration.ZERO;
    }
    log.info("Fetched Bot Connector token, valid for {}s", expiresIn);
    return new CachedToken(token, Instant.now().plus(lifetime));
  }

  private record CachedToken(String value, Instant expiresAt) {}
}
