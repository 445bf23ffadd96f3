package com.geniebridge.relay.api;

import com.geniebridge.relay.bot.BotAdapter;
import com.geniebridge.relay.bot.model.Activity;
import com.geniebridge.relay.bot.model.InvokeResponse;
import com.geniebridge.relay.config.RelayProperties;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bot Framework messaging endpoint.
 *
 * <p>The turn runs on the relay executor; the servlet thread is released while Genie is working.
 * Replies go out through the Bot Connector, so the HTTP answer is an empty 201 unless the activity
 * needs a synchronous invoke response.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class BotMessagesController {

  private final BotAdapter adapter;
  private final Executor relayExecutor;
  private final Duration requestTimeout;

  public BotMessagesController(
      BotAdapter adapter,
      @Qualifier("relayExecutor") Executor relayExecutor,
      RelayProperties properties) {
    this.adapter = adapter;
    this.relayExecutor = relayExecutor;
    this.requestTimeout = properties.requestTimeout();
  }

  @PostMapping(path = "/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<ResponseEntity<Object>> messages(
      @Valid @RequestBody Activity activity,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader) {
    adapter.authenticate(authHeader);

    CompletableFuture<ResponseEntity<Object>> future =
        CompletableFuture.supplyAsync(
            () -> toResponse(adapter.processActivity(activity)), relayExecutor);
    if (!requestTimeout.isZero() && !requestTimeout.isNegative()) {
      future = future.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    return future;
  }

  private static ResponseEntity<Object> toResponse(Optional<InvokeResponse> invoke) {
    if (invoke.isPresent()) {
      InvokeResponse response = invoke.get();
      return ResponseEntity.status(response.status()).body(response.body());
    }
    return ResponseEntity.status(HttpStatus.CREATED).build();
  }
}
