package com.chatguard.nlp.extraction;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.GeoLocationMatch;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.ahocorasick.SearchResult;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.cache.MatcherCache;
import com.chatguard.nlp.payload.GeoLocationPayload;

/**
 * Finds provinces, cities and districts. A match fills the field of its own
 * level plus the ancestor fields resolved when the matcher was built; fields
 * below its level stay null.
 */
public class GeoLocationExtractor
    extends AbstractKeywordExtractor<GeoLocationPayload, GeoLocationMatch> {
  private static final Logger log = LoggerFactory.getLogger(GeoLocationExtractor.class);

  public GeoLocationExtractor(MatcherCache<GeoLocationPayload> cache,
                              KeywordSource<GeoLocationPayload> source) {
    super(cache, source);
  }

  static GeoLocationMatch toMatch(GeoLocationPayload payload, String keyword) {
    String province = null;
    String city = null;
    String district = null;
    switch (payload.getLevel()) {
    case PROVINCE:
      province = payload.getName();
      break;
    case CITY:
      province = payload.getProvinceName();
      city = payload.getName();
      break;
    case DISTRICT:
      province = payload.getProvinceName();
      city = payload.getCityName();
      district = payload.getName();
      break;
    }
    return new GeoLocationMatch(payload, keyword, province, city, district);
  }

  @Override
  protected List<GeoLocationMatch> extractCore(
      AhoCorasick<GeoLocationPayload> matcher, String text) {
    List<GeoLocationMatch> locations = new ArrayList<>();
    for (SearchResult<GeoLocationPayload> result : matcher.searchUnique(text)) {
      GeoLocationMatch match = toMatch(result.getPayload(), result.getKeyword());
      log.trace("Found location: {}", match);
      locations.add(match);
    }
    return locations;
  }
}
