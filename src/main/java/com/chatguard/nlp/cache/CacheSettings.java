package com.chatguard.nlp.cache;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;

import com.google.common.base.MoreObjects;

/**
 * Per-domain matcher cache options.
 */
public final class CacheSettings {

  public static final Duration DEFAULT_TTL = Duration.ofHours(1);
  public static final boolean DEFAULT_CASE_SENSITIVE = false;
  public static final boolean DEFAULT_IDENTITY_CHECK = false;

  public static CacheSettings defaults() {
    return new CacheSettings(DEFAULT_TTL, DEFAULT_CASE_SENSITIVE,
                             DEFAULT_IDENTITY_CHECK);
  }

  public static CacheSettings ofTtl(Duration ttl) {
    return new CacheSettings(ttl, DEFAULT_CASE_SENSITIVE, DEFAULT_IDENTITY_CHECK);
  }

  private final Duration ttl;
  private final boolean caseSensitive;
  private final boolean identityCheck;

  public CacheSettings(Duration ttl, boolean caseSensitive,
                       boolean identityCheck) {
    checkNotNull(ttl, "ttl cannot be null");
    checkArgument(!ttl.isNegative(), "ttl cannot be negative: %s", ttl);
    this.ttl = ttl;
    this.caseSensitive = caseSensitive;
    this.identityCheck = identityCheck;
  }

  public Duration getTtl() {
    return this.ttl;
  }

  public boolean isCaseSensitive() {
    return this.caseSensitive;
  }

  /**
   * When true, an expired entry whose freshly fetched source equals the
   * previous one keeps its matcher instead of being rebuilt.
   */
  public boolean isIdentityCheck() {
    return this.identityCheck;
  }

  public CacheSettings withCaseSensitive(boolean caseSensitive) {
    return new CacheSettings(this.ttl, caseSensitive, this.identityCheck);
  }

  public CacheSettings withIdentityCheck(boolean identityCheck) {
    return new CacheSettings(this.ttl, this.caseSensitive, identityCheck);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ttl", this.ttl)
        .add("caseSensitive", this.caseSensitive)
        .add("identityCheck", this.identityCheck)
        .toString();
  }
}
