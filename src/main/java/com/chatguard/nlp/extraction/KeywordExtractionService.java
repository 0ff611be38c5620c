package com.chatguard.nlp.extraction;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.List;
import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.DarkKeywordMatch;
import com.chatguard.api.data.MessageAnalysis;
import com.chatguard.api.repository.DarkKeywordRepository;
import com.chatguard.api.repository.GeoLocationRepository;
import com.chatguard.api.repository.JsonKeywordRepository;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.api.repository.TagKeywordRepository;
import com.chatguard.api.repository.TransactionMethodRepository;
import com.chatguard.nlp.cache.MatcherCache;
import com.chatguard.nlp.cache.MatcherConfig;
import com.chatguard.nlp.payload.DarkKeywordPayload;
import com.chatguard.nlp.payload.GeoLocationPayload;
import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.nlp.payload.TagKeywordPayload;
import com.chatguard.nlp.payload.TransactionMethodPayload;
import com.chatguard.nlp.source.DarkKeywordSource;
import com.chatguard.nlp.source.GeoLocationKeywordSource;
import com.chatguard.nlp.source.TagKeywordSource;
import com.chatguard.nlp.source.TransactionMethodKeywordSource;
import com.google.common.base.Stopwatch;

/**
 * Entry point of the keyword engine: owns one cached matcher per domain and
 * runs all of them (plus price extraction) over a chat message.
 */
public class KeywordExtractionService {
  private static final Logger log = LoggerFactory.getLogger(KeywordExtractionService.class);

  public static <R extends TransactionMethodRepository & DarkKeywordRepository
                 & GeoLocationRepository & TagKeywordRepository>
      KeywordExtractionService of(R repository, MatcherConfig config) {
    return new KeywordExtractionService(repository, repository, repository,
                                        repository, config);
  }

  // Reads messages from stdin and prints what was found, for checking a
  // keyword configuration by hand.
  public static void main(String[] args) throws IOException, KeywordSourceException {
    if (args.length != 1) {
      System.err.println("Usage: KeywordExtractionService <keywords.json>");
      System.exit(1);
    }
    KeywordExtractionService service = KeywordExtractionService.of(
        JsonKeywordRepository.fromResource(args[0]), MatcherConfig.load());

    Scanner scanner = new Scanner(System.in, "UTF-8");
    while (true) {
      System.out.print("Enter a message: ");
      if (!scanner.hasNextLine()) break;
      String text = scanner.nextLine();
      if (text.isEmpty()) continue;
      if (text.equalsIgnoreCase("exit")) break;
      System.out.println(service.analyze(text).toJson());
    }
    scanner.close();
  }

  private static <T> MatcherCache<T> newCache(MatcherConfig config,
                                              KeywordDomain domain) {
    return new MatcherCache<>(domain.getKey(), config.getSettings(domain));
  }

  private final TransactionMethodExtractor transactionMethodExtractor;
  private final DarkKeywordExtractor darkKeywordExtractor;
  private final GeoLocationExtractor geoLocationExtractor;
  private final AutoTagger autoTagger;
  private final PriceExtractor priceExtractor;

  public KeywordExtractionService(TransactionMethodRepository transactionMethods,
                                  DarkKeywordRepository darkKeywords,
                                  GeoLocationRepository geoLocations,
                                  TagKeywordRepository tags,
                                  MatcherConfig config) {
    checkNotNull(config, "config cannot be null");
    this.transactionMethodExtractor = new TransactionMethodExtractor(
        KeywordExtractionService.<TransactionMethodPayload>newCache(
            config, KeywordDomain.TRANSACTION_METHOD),
        new TransactionMethodKeywordSource(transactionMethods));
    this.darkKeywordExtractor = new DarkKeywordExtractor(
        KeywordExtractionService.<DarkKeywordPayload>newCache(
            config, KeywordDomain.DARK_KEYWORD),
        new DarkKeywordSource(darkKeywords));
    this.geoLocationExtractor = new GeoLocationExtractor(
        KeywordExtractionService.<GeoLocationPayload>newCache(
            config, KeywordDomain.GEO_LOCATION),
        new GeoLocationKeywordSource(geoLocations));
    this.autoTagger = new AutoTagger(
        KeywordExtractionService.<TagKeywordPayload>newCache(
            config, KeywordDomain.TAG_KEYWORD),
        new TagKeywordSource(tags));
    this.priceExtractor = PriceExtractor.getInstance();
  }

  /**
   * Runs every extractor over the message. Dark keywords are counted, so
   * repeated mentions weigh in. Never throws.
   */
  public MessageAnalysis analyze(String text) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<DarkKeywordMatch> darkKeywords =
        this.darkKeywordExtractor.extractWithCount(text);
    MessageAnalysis analysis = new MessageAnalysis(
        this.transactionMethodExtractor.extract(text),
        darkKeywords,
        this.geoLocationExtractor.extract(text),
        this.autoTagger.match(text),
        this.priceExtractor.extract(text));
    log.debug("Analyzed message ({} chars) in {}",
              (text == null) ? 0 : text.length(), stopwatch);
    return analysis;
  }

  public AutoTagger getAutoTagger() {
    return this.autoTagger;
  }

  public DarkKeywordExtractor getDarkKeywordExtractor() {
    return this.darkKeywordExtractor;
  }

  public GeoLocationExtractor getGeoLocationExtractor() {
    return this.geoLocationExtractor;
  }

  public PriceExtractor getPriceExtractor() {
    return this.priceExtractor;
  }

  public TransactionMethodExtractor getTransactionMethodExtractor() {
    return this.transactionMethodExtractor;
  }

  public void refreshDarkKeywords() {
    this.darkKeywordExtractor.refresh();
  }

  public void refreshGeoLocations() {
    this.geoLocationExtractor.refresh();
  }

  public void refreshTags() {
    this.autoTagger.refresh();
  }

  public void refreshTransactionMethods() {
    this.transactionMethodExtractor.refresh();
  }
}
