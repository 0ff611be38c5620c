package com.chatguard.nlp.extraction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.PriceMention;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/**
 * Pulls quoted prices out of a message with two patterns: a unit price such
 * as {@code 100元/克} or {@code 50块}, and a price range such as
 * {@code 100-200元}, which is reported as its mean.
 *
 * <p>Digits and spaces are matched in their Unicode sense, so full-width
 * quotes like {@code １００元/克} are found too.</p>
 */
public class PriceExtractor {
  private static final Logger log = LoggerFactory.getLogger(PriceExtractor.class);

  public static final double PRICE_CONFIDENCE = 0.95;
  public static final double MIN_VALUE = 1;
  public static final double MAX_VALUE = 100000;

  public static final String UNIT_GRAM = "g";
  public static final String UNIT_PIECE = "piece";
  public static final String UNIT_PORTION = "portion";
  public static final String UNIT_STICK = "stick";
  public static final String UNIT_TABLET = "tablet";

  private static final Pattern UNIT_PRICE = Pattern.compile(
      "(\\d+(?:\\.\\d+)?)\\s*(?:元|￥|¥)?\\s*(?:/)?(?:克|块|份|条|片)",
      Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern PRICE_RANGE = Pattern.compile(
      "(\\d+(?:\\.\\d+)?)\\s*[-~]\\s*(\\d+(?:\\.\\d+)?)\\s*(?:元|￥|¥)",
      Pattern.UNICODE_CHARACTER_CLASS);

  private static PriceExtractor instance = null;

  public static synchronized PriceExtractor getInstance() {
    if (instance == null) instance = new PriceExtractor();
    return instance;
  }

  static String parseUnit(String matched) {
    if (matched.contains("块")) return UNIT_PIECE;
    if (matched.contains("份")) return UNIT_PORTION;
    if (matched.contains("条")) return UNIT_STICK;
    if (matched.contains("片")) return UNIT_TABLET;
    return UNIT_GRAM;
  }

  /** Parses a matched number, mapping any Unicode decimal digit to ASCII. */
  static Double parseNumber(String number) {
    StringBuilder ascii = new StringBuilder(number.length());
    for (int i = 0; i < number.length(); ++i) {
      char c = number.charAt(i);
      if (Character.isDigit(c)) c = Character.forDigit(Character.digit(c, 10), 10);
      ascii.append(c);
    }
    return Doubles.tryParse(ascii.toString());
  }

  static double round2(double value) {
    return Math.round(value * 100) / 100.0;
  }

  private static boolean isInRange(double value) {
    return value >= MIN_VALUE && value <= MAX_VALUE;
  }

  /**
   * Unit prices come first, then ranges, each in text order. Only the first
   * mention of a given (value, unit) is kept.
   */
  public List<PriceMention> extract(String text) {
    if (StringUtils.isBlank(text)) return ImmutableList.of();

    List<PriceMention> prices = new ArrayList<>();
    try {
      Matcher matcher = UNIT_PRICE.matcher(text);
      while (matcher.find()) {
        Double value = parseNumber(matcher.group(1));
        if (value == null || !isInRange(value)) continue;
        prices.add(new PriceMention(round2(value), parseUnit(matcher.group()),
                                    matcher.group(), PRICE_CONFIDENCE));
      }

      matcher = PRICE_RANGE.matcher(text);
      while (matcher.find()) {
        Double low = parseNumber(matcher.group(1));
        Double high = parseNumber(matcher.group(2));
        if (low == null || high == null) continue;
        double mean = (low + high) / 2;
        if (!isInRange(mean)) continue;
        prices.add(new PriceMention(round2(mean), UNIT_GRAM, matcher.group(),
                                    PRICE_CONFIDENCE));
      }
    } catch (RuntimeException e) {
      log.error("Error extracting prices: {}", e.getMessage(), e);
      return ImmutableList.of();
    }
    return deduplicate(prices);
  }

  private List<PriceMention> deduplicate(List<PriceMention> prices) {
    List<PriceMention> unique = new ArrayList<>();
    Set<Pair<Double, String>> seen = new HashSet<>();
    for (PriceMention price : prices) {
      if (seen.add(Pair.of(price.getValue(), price.getUnit()))) {
        unique.add(price);
      }
    }
    log.trace("Found {} price(s), {} after dedup", prices.size(), unique.size());
    return unique;
  }
}
