package com.chatguard.nlp.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.DarkKeywordMatch;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.ahocorasick.SearchResult;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.cache.MatcherCache;
import com.chatguard.nlp.payload.DarkKeywordPayload;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;

/**
 * Finds restricted-substance keywords. {@link #extract} lists each
 * (drug, keyword) pair once; {@link #extractWithCount} also counts how often
 * every keyword occurs and ranks the results by weight.
 */
public class DarkKeywordExtractor
    extends AbstractKeywordExtractor<DarkKeywordPayload, DarkKeywordMatch> {
  private static final Logger log = LoggerFactory.getLogger(DarkKeywordExtractor.class);

  private static final Comparator<DarkKeywordMatch> BY_WEIGHT_DESC =
      new Comparator<DarkKeywordMatch>() {
        @Override
        public int compare(DarkKeywordMatch m1, DarkKeywordMatch m2) {
          return Integer.compare(m2.getWeight(), m1.getWeight());
        }
      };

  public DarkKeywordExtractor(MatcherCache<DarkKeywordPayload> cache,
                              KeywordSource<DarkKeywordPayload> source) {
    super(cache, source);
  }

  /**
   * Counts every occurrence (overlaps included) of each keyword. A keyword
   * configured under several drugs still counts once per position, and the
   * first payload seen for it is reported. Results with the same weight keep
   * the order in which their keywords first appeared.
   */
  public List<DarkKeywordMatch> extractWithCount(String text) {
    if (StringUtils.isBlank(text)) return ImmutableList.of();
    try {
      AhoCorasick<DarkKeywordPayload> matcher = getMatcher();
      Multiset<String> counts = LinkedHashMultiset.create();
      Map<String, DarkKeywordPayload> firstPayloads = new LinkedHashMap<>();
      Set<Pair<Integer, String>> occurrences = Sets.newHashSet();
      for (SearchResult<DarkKeywordPayload> result : matcher.search(text)) {
        if (!occurrences.add(Pair.of(result.getPosition(), result.getKeyword()))) {
          continue;
        }
        counts.add(result.getKeyword());
        firstPayloads.putIfAbsent(result.getKeyword(), result.getPayload());
      }

      List<DarkKeywordMatch> matches = new ArrayList<>();
      for (Multiset.Entry<String> entry : counts.entrySet()) {
        matches.add(new DarkKeywordMatch(
            entry.getElement(), firstPayloads.get(entry.getElement()),
            entry.getCount(), KEYWORD_CONFIDENCE));
      }
      Collections.sort(matches, BY_WEIGHT_DESC);  // Stable.
      return matches;
    } catch (RuntimeException e) {
      log.error("Error counting dark keywords: {}", e.getMessage(), e);
      return ImmutableList.of();
    }
  }

  @Override
  protected List<DarkKeywordMatch> extractCore(
      AhoCorasick<DarkKeywordPayload> matcher, String text) {
    List<DarkKeywordMatch> matches = new ArrayList<>();
    Set<Pair<Long, String>> seen = Sets.newHashSet();
    for (SearchResult<DarkKeywordPayload> result : matcher.searchUnique(text)) {
      DarkKeywordPayload payload = result.getPayload();
      if (seen.add(Pair.of(payload.getDrugId(), result.getKeyword()))) {
        matches.add(new DarkKeywordMatch(result.getKeyword(), payload, 1,
                                         KEYWORD_CONFIDENCE));
      }
    }
    return matches;
  }
}
