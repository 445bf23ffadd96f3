package com.geniebridge.relay.client;

/** Any failure talking to the Genie or statement execution APIs. */
public class GenieClientException extends RuntimeException {
  public GenieClientException(String message) {
    super(message);
  }

  public GenieClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
