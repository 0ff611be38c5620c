package com.chatguard.api.repository;

/**
 * The keyword configuration is not reachable at all: there is no
 * request/session context, or the backing store is not configured. Callers
 * treat this as "no keywords" rather than as a failure.
 */
public class ConfigurationUnavailableException extends KeywordSourceException {
  private static final long serialVersionUID = 1L;

  public ConfigurationUnavailableException(String message) {
    super(message);
  }

  public ConfigurationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
