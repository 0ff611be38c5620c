package com.chatguard.nlp.cache;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.utils.FileUtil;
import com.google.common.primitives.Longs;

/**
 * Cache settings of every keyword domain, read from
 * {@value #CONFIG_PROP_FILE}. Each key can be overridden by a system property
 * with the {@value #SYSTEM_PROPERTY_PREFIX} prefix, e.g.
 * {@code -Dchatguard.geo-location.ttl-seconds=600}.
 */
public class MatcherConfig {
  private static final Logger log = LoggerFactory.getLogger(MatcherConfig.class);

  public static final String CONFIG_PROP_FILE = "keyword-matcher.properties";
  public static final String SYSTEM_PROPERTY_PREFIX = "chatguard.";

  static final String TTL_SECONDS = "ttl-seconds";
  static final String CASE_SENSITIVE = "case-sensitive";
  static final String IDENTITY_CHECK = "identity-check";

  // Tag mappings are edited often from the admin pages.
  static final Duration TAG_KEYWORD_TTL = Duration.ofMinutes(5);

  public static MatcherConfig load() throws IOException {
    return fromProperties(FileUtil.loadProperties(CONFIG_PROP_FILE),
                          System.getProperties());
  }

  public static MatcherConfig defaults() {
    return fromProperties(new Properties(), new Properties());
  }

  /**
   * Builds the settings from {@code props}, letting {@code overrides} (keys
   * prefixed with {@value #SYSTEM_PROPERTY_PREFIX}) win.
   */
  public static MatcherConfig fromProperties(Properties props,
                                             Properties overrides) {
    Map<KeywordDomain, CacheSettings> settings = new EnumMap<>(KeywordDomain.class);
    for (KeywordDomain domain : KeywordDomain.values()) {
      CacheSettings fallback = defaultSettings(domain);
      long ttlSeconds = readLong(props, overrides, domain, TTL_SECONDS,
                                 fallback.getTtl().getSeconds());
      boolean caseSensitive = readBoolean(props, overrides, domain,
                                          CASE_SENSITIVE,
                                          fallback.isCaseSensitive());
      boolean identityCheck = readBoolean(props, overrides, domain,
                                          IDENTITY_CHECK,
                                          fallback.isIdentityCheck());
      settings.put(domain, new CacheSettings(Duration.ofSeconds(ttlSeconds),
                                             caseSensitive, identityCheck));
    }
    MatcherConfig config = new MatcherConfig(settings);
    log.debug("Matcher settings: {}", settings);
    return config;
  }

  static CacheSettings defaultSettings(KeywordDomain domain) {
    if (domain == KeywordDomain.TAG_KEYWORD) {
      return new CacheSettings(TAG_KEYWORD_TTL, false, true);
    }
    return CacheSettings.defaults();
  }

  private static String lookup(Properties props, Properties overrides,
                               KeywordDomain domain, String name) {
    String key = domain.getKey() + "." + name;
    String value = overrides.getProperty(SYSTEM_PROPERTY_PREFIX + key);
    if (StringUtils.isBlank(value)) value = props.getProperty(key);
    return StringUtils.trimToNull(value);
  }

  private static boolean readBoolean(Properties props, Properties overrides,
                                     KeywordDomain domain, String name,
                                     boolean defaultValue) {
    String value = lookup(props, overrides, domain, name);
    if (value == null) return defaultValue;
    Boolean parsed = BooleanUtils.toBooleanObject(value);
    if (parsed == null) {
      log.warn("Invalid boolean for {}.{}: \"{}\", using {}", domain.getKey(),
               name, value, defaultValue);
      return defaultValue;
    }
    return parsed;
  }

  private static long readLong(Properties props, Properties overrides,
                               KeywordDomain domain, String name,
                               long defaultValue) {
    String value = lookup(props, overrides, domain, name);
    if (value == null) return defaultValue;
    Long parsed = Longs.tryParse(value);
    if (parsed == null || parsed < 0) {
      log.warn("Invalid number for {}.{}: \"{}\", using {}", domain.getKey(),
               name, value, defaultValue);
      return defaultValue;
    }
    return parsed;
  }

  private final Map<KeywordDomain, CacheSettings> settings;

  private MatcherConfig(Map<KeywordDomain, CacheSettings> settings) {
    this.settings = settings;
  }

  public CacheSettings getSettings(KeywordDomain domain) {
    return checkNotNull(this.settings.get(checkNotNull(domain)));
  }
}
