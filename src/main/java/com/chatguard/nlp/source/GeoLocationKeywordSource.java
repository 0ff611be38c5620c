package com.chatguard.nlp.source;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.GeoLocationRecord;
import com.chatguard.api.repository.GeoLocationRepository;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.payload.GeoLevel;
import com.chatguard.nlp.payload.GeoLocationPayload;
import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.utils.StringUtil;

/**
 * Loads every active place under its name, its aliases and its short name.
 * All variants of a place share one payload, which already carries the names
 * of its parent, city and province.
 */
public class GeoLocationKeywordSource extends AbstractKeywordSource<GeoLocationPayload> {
  private static final Logger log = LoggerFactory.getLogger(GeoLocationKeywordSource.class);

  // A district is at most two hops below its province.
  private static final int MAX_ANCESTOR_HOPS = GeoLevel.values().length - 1;

  private final GeoLocationRepository repository;

  public GeoLocationKeywordSource(GeoLocationRepository repository) {
    super(KeywordDomain.GEO_LOCATION);
    this.repository = checkNotNull(repository, "repository cannot be null");
  }

  /**
   * Returns the keyword variants of a place: name, aliases, then short name,
   * without blanks or repeats.
   */
  static Set<String> keywordVariants(GeoLocationRecord location) {
    Set<String> variants = new LinkedHashSet<>();
    if (StringUtils.isNotBlank(location.name)) variants.add(location.name.trim());
    variants.addAll(StringUtil.splitCommaList(location.aliases));
    if (StringUtils.isNotBlank(location.shortName)) {
      variants.add(location.shortName.trim());
    }
    return variants;
  }

  @Override
  protected void collect(List<KeywordEntry<GeoLocationPayload>> entries)
      throws KeywordSourceException {
    List<GeoLocationRecord> locations = this.repository.findLocations();

    Map<Long, GeoLocationRecord> activeById = new HashMap<>();
    for (GeoLocationRecord location : locations) {
      if (location != null && location.active) {
        activeById.put(location.id, location);
      }
    }

    for (GeoLocationRecord location : locations) {
      if (location == null || !location.active) continue;
      GeoLevel level;
      try {
        level = GeoLevel.fromCode(location.level);
      } catch (IllegalArgumentException e) {
        log.warn("Skipping {} (id={}): {}", location.name, location.id,
                 e.getMessage());
        continue;
      }
      if (StringUtils.isBlank(location.name)) continue;

      GeoLocationPayload payload = resolve(location, level, activeById);
      for (String variant : keywordVariants(location)) {
        addKeyword(entries, variant, payload);
      }
    }
  }

  /**
   * Walks up the parent chain (only through active rows) and records the
   * names of the city and province above this place.
   */
  private static GeoLocationPayload resolve(
      GeoLocationRecord location, GeoLevel level,
      Map<Long, GeoLocationRecord> activeById) {
    GeoLocationPayload.Builder builder = GeoLocationPayload.builder()
        .setId(location.id)
        .setName(location.name.trim())
        .setLevel(level)
        .setCoordinates(location.latitude, location.longitude);

    if (level == GeoLevel.PROVINCE || location.parentId == null) {
      return builder.setParent(location.parentId, null).build();
    }

    GeoLocationRecord parent = activeById.get(location.parentId);
    builder.setParent(location.parentId,
                      (parent == null) ? null : StringUtils.trim(parent.name));

    GeoLocationRecord ancestor = parent;
    for (int hops = 0; ancestor != null && hops < MAX_ANCESTOR_HOPS; ++hops) {
      if (ancestor.level == GeoLevel.PROVINCE.getCode()) {
        builder.setProvinceName(StringUtils.trim(ancestor.name));
        break;
      }
      if (ancestor.level == GeoLevel.CITY.getCode()) {
        builder.setCityName(StringUtils.trim(ancestor.name));
      }
      ancestor = (ancestor.parentId == null) ? null :
                 activeById.get(ancestor.parentId);
    }
    return builder.build();
  }
}
