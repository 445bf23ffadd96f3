package com.geniebridge.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Bot Framework application credentials. Empty app id means emulator mode (no auth). */
@ConfigurationProperties(prefix = "bot")
public record BotProperties(
    String appId, String appPassword, String tokenUrl, String tokenScope) {

  public BotProperties {
    appId = appId == null ? "" : appId.trim();
    appPassword = appPassword == null ? "" : appPassword.trim();
    tokenUrl =
        tokenUrl == null || tokenUrl.isBlank()
            ? "https://login.microsoftonline.com/botframework.com/oauth2/v2.0/token"
            : tokenUrl.trim();
    tokenScope =
        tokenScope == null || tokenScope.isBlank()
            ? "https://api.botframework.com/.default"
            : tokenScope.trim();
  }

  public boolean isAuthEnabled() {
    return !appId.isBlank();
  }
}
