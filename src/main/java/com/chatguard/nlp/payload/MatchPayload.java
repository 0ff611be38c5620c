package com.chatguard.nlp.payload;

/**
 * Metadata attached to a keyword. Every domain has its own implementation;
 * {@link #getDomain()} tells them apart.
 */
public interface MatchPayload {
  public KeywordDomain getDomain();
}
