package com.geniebridge.relay.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Genie workspace.
 *
 * <p>{@code timeout} bounds a single HTTP call, {@code waitTimeout} bounds the whole wait for a
 * message to finish processing.
 */
@Validated
@ConfigurationProperties(prefix = "genie")
public record GenieProperties(
    @NotBlank String host,
    @NotBlank String token,
    @NotBlank String spaceId,
    Duration timeout,
    Duration pollInterval,
    Duration maxPollInterval,
    Duration waitTimeout) {

  public GenieProperties {
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
    maxPollInterval = maxPollInterval == null ? Duration.ofSeconds(10) : maxPollInterval;
    waitTimeout = waitTimeout == null ? Duration.ofMinutes(20) : waitTimeout;
  }
}
