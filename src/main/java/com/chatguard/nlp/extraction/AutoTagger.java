package com.chatguard.nlp.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.chatguard.api.data.TagMatch;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.ahocorasick.SearchResult;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.cache.MatcherCache;
import com.chatguard.nlp.payload.TagKeywordPayload;

/**
 * Maps messages onto user tags through the tag keyword mappings.
 */
public class AutoTagger extends AbstractKeywordExtractor<TagKeywordPayload, TagMatch> {

  public AutoTagger(MatcherCache<TagKeywordPayload> cache,
                    KeywordSource<TagKeywordPayload> source) {
    super(cache, source);
  }

  /** Ids of the tags hit by the text, in order of first appearance. */
  public Set<Long> distinctTagIds(String text) {
    Set<Long> tagIds = new LinkedHashSet<>();
    for (TagMatch match : match(text)) {
      tagIds.add(match.getTagId());
    }
    return tagIds;
  }

  public List<TagMatch> match(String text) {
    return extract(text);
  }

  @Override
  protected List<TagMatch> extractCore(AhoCorasick<TagKeywordPayload> matcher,
                                       String text) {
    List<TagMatch> matches = new ArrayList<>();
    for (SearchResult<TagKeywordPayload> result : matcher.searchUnique(text)) {
      TagKeywordPayload payload = result.getPayload();
      matches.add(new TagMatch(payload.getTagId(), result.getKeyword(),
                               payload.isAutoFocus(), payload.getMappingId(),
                               result.getPosition()));
    }
    return matches;
  }
}
