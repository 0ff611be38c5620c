package com.chatguard.nlp.extraction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.chatguard.api.data.TransactionMethodMatch;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.ahocorasick.SearchResult;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.cache.MatcherCache;
import com.chatguard.nlp.payload.TransactionMethodPayload;

/**
 * Finds how a deal is carried out (dead drop, courier, ...). Each method is
 * reported once, under the first keyword that hit it.
 */
public class TransactionMethodExtractor
    extends AbstractKeywordExtractor<TransactionMethodPayload, TransactionMethodMatch> {

  public TransactionMethodExtractor(MatcherCache<TransactionMethodPayload> cache,
                                    KeywordSource<TransactionMethodPayload> source) {
    super(cache, source);
  }

  @Override
  protected List<TransactionMethodMatch> extractCore(
      AhoCorasick<TransactionMethodPayload> matcher, String text) {
    List<TransactionMethodMatch> methods = new ArrayList<>();
    Set<String> seenMethods = new HashSet<>();
    for (SearchResult<TransactionMethodPayload> result : matcher.searchUnique(text)) {
      String method = result.getPayload().getMethodName();
      if (seenMethods.add(method)) {
        methods.add(new TransactionMethodMatch(method, result.getKeyword(),
                                               KEYWORD_CONFIDENCE));
      }
    }
    return methods;
  }
}
