package com.chatguard.api.repository;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.DarkKeywordCategory;
import com.chatguard.api.data.DarkKeywordDrug;
import com.chatguard.api.data.DarkKeywordKeyword;
import com.chatguard.api.data.GeoLocationRecord;
import com.chatguard.api.data.TagKeywordMapping;
import com.chatguard.api.data.TransactionMethodConfig;
import com.chatguard.utils.FileUtil;
import com.chatguard.utils.StringUtil;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Keyword configuration read from a JSON document instead of the database.
 * Used for fixtures and for running the matchers without the admin backend.
 */
public class JsonKeywordRepository implements TransactionMethodRepository,
    DarkKeywordRepository, GeoLocationRepository, TagKeywordRepository {
  private static final Logger log = LoggerFactory.getLogger(JsonKeywordRepository.class);

  /** JSON Data object. Mirrors the layout of the configuration tables. */
  static class KeywordConfiguration {
    @SerializedName("transaction_methods")
    List<TransactionMethodConfig> transactionMethods = new ArrayList<>();
    @SerializedName("dark_keyword_categories")
    List<DarkKeywordCategory> darkKeywordCategories = new ArrayList<>();
    @SerializedName("dark_keyword_drugs")
    List<DarkKeywordDrug> darkKeywordDrugs = new ArrayList<>();
    @SerializedName("dark_keywords")
    List<DarkKeywordKeyword> darkKeywords = new ArrayList<>();
    @SerializedName("geo_locations")
    List<GeoLocationRecord> geoLocations = new ArrayList<>();
    @SerializedName("tag_keywords")
    List<TagKeywordMapping> tagKeywords = new ArrayList<>();
  }

  public static JsonKeywordRepository fromJson(String json)
      throws KeywordSourceException {
    try {
      KeywordConfiguration config =
          StringUtil.getGsonInstance().fromJson(json, KeywordConfiguration.class);
      if (config == null) {
        throw new KeywordSourceException("Empty keyword configuration");
      }
      return new JsonKeywordRepository(config);
    } catch (JsonParseException e) {
      throw new KeywordSourceException("Malformed keyword configuration", e);
    }
  }

  /**
   * Reads the configuration from a file or class-path resource. A missing
   * resource means there is no configuration at all.
   */
  public static JsonKeywordRepository fromResource(String path)
      throws KeywordSourceException {
    log.info("Loading keyword configuration from: {}", path);
    try (InputStream stream = FileUtil.findResourceAsStream(path)) {
      if (stream == null) {
        throw new ConfigurationUnavailableException(
            "Keyword configuration not found: " + path);
      }
      return fromJson(FileUtil.inputStreamToCharSource(stream).read());
    } catch (IOException e) {
      throw new KeywordSourceException("Error reading " + path, e);
    }
  }

  private final KeywordConfiguration config;

  JsonKeywordRepository(KeywordConfiguration config) {
    this.config = checkNotNull(config);
  }

  @Override
  public List<DarkKeywordCategory> findCategories() {
    return nullToEmpty(this.config.darkKeywordCategories);
  }

  @Override
  public List<DarkKeywordDrug> findDrugs() {
    return nullToEmpty(this.config.darkKeywordDrugs);
  }

  @Override
  public List<DarkKeywordKeyword> findKeywords() {
    return nullToEmpty(this.config.darkKeywords);
  }

  @Override
  public List<GeoLocationRecord> findLocations() {
    return nullToEmpty(this.config.geoLocations);
  }

  @Override
  public List<TagKeywordMapping> findMappings() {
    return nullToEmpty(this.config.tagKeywords);
  }

  @Override
  public List<TransactionMethodConfig> findMethods() {
    return nullToEmpty(this.config.transactionMethods);
  }

  private static <T> List<T> nullToEmpty(List<T> list) {
    return (list == null) ? ImmutableList.<T>of() : list;
  }
}
