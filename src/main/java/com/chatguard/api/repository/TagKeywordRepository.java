package com.chatguard.api.repository;

import java.util.List;

import com.chatguard.api.data.TagKeywordMapping;

public interface TagKeywordRepository {
  public List<TagKeywordMapping> findMappings() throws KeywordSourceException;
}
