package com.chatguard.nlp.source;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.chatguard.api.data.TagKeywordMapping;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.api.repository.TagKeywordRepository;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.nlp.payload.TagKeywordPayload;

public class TagKeywordSource extends AbstractKeywordSource<TagKeywordPayload> {

  private final TagKeywordRepository repository;

  public TagKeywordSource(TagKeywordRepository repository) {
    super(KeywordDomain.TAG_KEYWORD);
    this.repository = checkNotNull(repository, "repository cannot be null");
  }

  @Override
  protected void collect(List<KeywordEntry<TagKeywordPayload>> entries)
      throws KeywordSourceException {
    for (TagKeywordMapping mapping : this.repository.findMappings()) {
      if (mapping == null || !mapping.active) continue;
      addKeyword(entries, mapping.keyword, new TagKeywordPayload(
          mapping.id, mapping.tagId, mapping.autoFocus));
    }
  }
}
