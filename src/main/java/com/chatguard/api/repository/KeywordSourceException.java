package com.chatguard.api.repository;

/**
 * Thrown when keyword configuration cannot be read from the data layer.
 */
public class KeywordSourceException extends Exception {
  private static final long serialVersionUID = 1L;

  public KeywordSourceException(String message) {
    super(message);
  }

  public KeywordSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
