package com.geniebridge.relay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geniebridge.relay.config.GenieProperties;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Blocking JSON calls against the Databricks workspace REST API. */
@Component
@Slf4j
public class WorkspaceApi {

  private final WebClient webClient;
  private final GenieProperties properties;

  public WorkspaceApi(WebClient genieWebClient, GenieProperties properties) {
    this.webClient = genieWebClient;
    this.properties = properties;
  }

  public JsonNode get(String path, Object... uriVariables) {
    log.debug("Workspace GET {}", path);
    return block(
        webClient
            .get()
            .uri(path, uriVariables)
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(WorkspaceApi::readJson),
        path);
  }

  public JsonNode post(String path, Map<String, ?> body, Object... uriVariables) {
    log.debug("Workspace POST {}", path);
    return block(
        webClient
            .post()
            .uri(path, uriVariables)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchangeToMono(WorkspaceApi::readJson),
        path);
  }

  private JsonNode block(Mono<JsonNode> call, String path) {
    JsonNode response;
    try {
      response = call.block(properties.timeout());
    } catch (GenieClientException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GenieClientException("Workspace call failed for " + path, e);
    }
    if (response == null) {
      throw new GenieClientException("Workspace returned empty response for " + path);
    }
    return response;
  }

  private static Mono<JsonNode> readJson(ClientResponse clientResponse) {
    if (clientResponse.statusCode().isError()) {
      return clientResponse
          .bodyToMono(String.class)
          .defaultIfEmpty("")
          .flatMap(
              body ->
                  Mono.error(
                      new GenieClientException(
                          "Workspace API error "
                              + clientResponse.statusCode().value()
                              + " "
                              + body)));
    }
    MediaType contentType =
        clientResponse.headers().contentType().orElse(MediaType.APPLICATION_OCTET_STREAM);
    if (isJson(contentType)) {
      return clientResponse.bodyToMono(JsonNode.class);
    }
    return clientResponse
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .flatMap(
            body ->
                Mono.error(
                    new GenieClientException(
                        "Workspace API returned non-JSON response (" + contentType + ")")));
  }

  private static boolean isJson(MediaType contentType) {
    if (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
      return true;
    }
    String subtype = contentType.getSubtype();
    return subtype != null && subtype.endsWith("+json");
  }
}
