package com.chatguard.api.data;

import java.util.List;

import com.chatguard.utils.StringUtil;
import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;

/**
 * Everything the keyword engine found in one chat message. This is what gets
 * handed to the record-insertion side, usually as JSON.
 */
public class MessageAnalysis {
  @SerializedName("transaction_methods")
  private final List<TransactionMethodMatch> transactionMethods;
  @SerializedName("dark_keywords")
  private final List<DarkKeywordMatch> darkKeywords;
  @SerializedName("geo_locations")
  private final List<GeoLocationMatch> geoLocations;
  private final List<TagMatch> tags;
  private final List<PriceMention> prices;

  public MessageAnalysis(List<TransactionMethodMatch> transactionMethods,
                         List<DarkKeywordMatch> darkKeywords,
                         List<GeoLocationMatch> geoLocations,
                         List<TagMatch> tags,
                         List<PriceMention> prices) {
    this.transactionMethods = ImmutableList.copyOf(transactionMethods);
    this.darkKeywords = ImmutableList.copyOf(darkKeywords);
    this.geoLocations = ImmutableList.copyOf(geoLocations);
    this.tags = ImmutableList.copyOf(tags);
    this.prices = ImmutableList.copyOf(prices);
  }

  public List<DarkKeywordMatch> getDarkKeywords() {
    return this.darkKeywords;
  }

  public List<GeoLocationMatch> getGeoLocations() {
    return this.geoLocations;
  }

  public List<PriceMention> getPrices() {
    return this.prices;
  }

  public List<TagMatch> getTags() {
    return this.tags;
  }

  public List<TransactionMethodMatch> getTransactionMethods() {
    return this.transactionMethods;
  }

  public boolean isEmpty() {
    return this.transactionMethods.isEmpty() && this.darkKeywords.isEmpty() &&
           this.geoLocations.isEmpty() && this.tags.isEmpty() &&
           this.prices.isEmpty();
  }

  public String toJson() {
    return StringUtil.toJson(this);
  }
}
