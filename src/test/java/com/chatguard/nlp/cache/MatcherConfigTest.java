package com.chatguard.nlp.cache;

import com.chatguard.nlp.payload.KeywordDomain;
import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.Assert.*;

public class MatcherConfigTest {

    @Test
    public void defaultsGiveTagsShortTtlAndIdentityCheck() {
        MatcherConfig config = MatcherConfig.defaults();

        CacheSettings geo = config.getSettings(KeywordDomain.GEO_LOCATION);
        assertEquals(Duration.ofHours(1), geo.getTtl());
        assertFalse(geo.isCaseSensitive());
        assertFalse(geo.isIdentityCheck());

        CacheSettings tags = config.getSettings(KeywordDomain.TAG_KEYWORD);
        assertEquals(Duration.ofSeconds(300), tags.getTtl());
        assertTrue(tags.isIdentityCheck());
    }

    @Test
    public void readsPropertiesAndLetsOverridesWin() {
        Properties props = new Properties();
        props.setProperty("dark-keyword.ttl-seconds", "120");
        props.setProperty("dark-keyword.case-sensitive", "true");
        props.setProperty("geo-location.ttl-seconds", "600");

        Properties overrides = new Properties();
        overrides.setProperty("chatguard.geo-location.ttl-seconds", "30");
        overrides.setProperty("chatguard.transaction-method.identity-check", "yes");

        MatcherConfig config = MatcherConfig.fromProperties(props, overrides);
        CacheSettings dark = config.getSettings(KeywordDomain.DARK_KEYWORD);
        assertEquals(Duration.ofSeconds(120), dark.getTtl());
        assertTrue(dark.isCaseSensitive());

        assertEquals(Duration.ofSeconds(30), config.getSettings(KeywordDomain.GEO_LOCATION).getTtl());
        assertTrue(config.getSettings(KeywordDomain.TRANSACTION_METHOD).isIdentityCheck());
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("dark-keyword.ttl-seconds", "soon");
        props.setProperty("geo-location.ttl-seconds", "-5");
        props.setProperty("tag-keyword.identity-check", "maybe");

        MatcherConfig config = MatcherConfig.fromProperties(props, new Properties());
        assertEquals(Duration.ofHours(1), config.getSettings(KeywordDomain.DARK_KEYWORD).getTtl());
        assertEquals(Duration.ofHours(1), config.getSettings(KeywordDomain.GEO_LOCATION).getTtl());
        assertTrue(config.getSettings(KeywordDomain.TAG_KEYWORD).isIdentityCheck());
    }

    @Test
    public void loadsBundledProperties() throws Exception {
        MatcherConfig config = MatcherConfig.load();
        assertEquals(Duration.ofSeconds(3600), config.getSettings(KeywordDomain.DARK_KEYWORD).getTtl());
        assertEquals(Duration.ofSeconds(300), config.getSettings(KeywordDomain.TAG_KEYWORD).getTtl());
    }
}
