package com.geniebridge.relay.render;

import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fixed user-facing strings. Defaults live here; {@code friendly.templates.*} overrides them and
 * {@code friendly.locales.<locale>.*} overrides per activity locale.
 */
@Component
@ConfigurationProperties(prefix = "friendly")
public class ReplyTemplates {

  public static final String WELCOME = "welcome";
  public static final String DECODE_FAILURE = "decode_failure";
  public static final String PROCESSING_FAILURE = "processing_failure";
  public static final String BACKEND_ERROR = "backend_error";

  private static final Map<String, String> DEFAULTS =
      Map.of(
          WELCOME, "Welcome to the Databricks Genie Bot!",
          DECODE_FAILURE, "Failed to decode response from the server.",
          PROCESSING_FAILURE, "An error occurred while processing your request.",
          BACKEND_ERROR, "An error occurred while processing your request.");

  private Map<String, String> templates = new HashMap<>();
  private Map<String, Map<String, String>> locales = new HashMap<>();

  /** Never returns {@code null} for the keys declared above. */
  public String resolve(String key, String locale) {
    if (key == null || key.isBlank()) {
      return null;
    }
    if (locale != null && locales.containsKey(locale)) {
      String localized = locales.get(locale).get(key);
      if (localized != null && !localized.isBlank()) {
        return localized;
      }
    }
    String configured = templates.get(key);
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    return DEFAULTS.get(key);
  }

  public String resolve(String key) {
    return resolve(key, null);
  }

  public Map<String, String> getTemplates() {
    return templates;
  }

  public void setTemplates(Map<String, String> templates) {
    this.templates = templates == null ? new HashMap<>() : templates;
  }

  public Map<String, Map<String, String>> getLocales() {
    return locales;
  }

  public void setLocales(Map<String, Map<String, String>> locales) {
    this.locales = locales == null ? new HashMap<>() : locales;
  }
}
