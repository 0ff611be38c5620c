package com.chatguard.nlp.source;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.data.DarkKeywordCategory;
import com.chatguard.api.data.DarkKeywordDrug;
import com.chatguard.api.data.DarkKeywordKeyword;
import com.chatguard.api.repository.DarkKeywordRepository;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.payload.DarkKeywordPayload;
import com.chatguard.nlp.payload.KeywordDomain;

/**
 * Joins category, drug and keyword rows. A keyword is loaded only if it, its
 * drug and the drug's category are all active.
 */
public class DarkKeywordSource extends AbstractKeywordSource<DarkKeywordPayload> {
  private static final Logger log = LoggerFactory.getLogger(DarkKeywordSource.class);

  private final DarkKeywordRepository repository;

  public DarkKeywordSource(DarkKeywordRepository repository) {
    super(KeywordDomain.DARK_KEYWORD);
    this.repository = checkNotNull(repository, "repository cannot be null");
  }

  @Override
  protected void collect(List<KeywordEntry<DarkKeywordPayload>> entries)
      throws KeywordSourceException {
    Map<Long, DarkKeywordCategory> categories = new HashMap<>();
    for (DarkKeywordCategory category : this.repository.findCategories()) {
      if (category != null && category.active) {
        categories.put(category.id, category);
      }
    }

    Map<Long, DarkKeywordDrug> drugs = new HashMap<>();
    for (DarkKeywordDrug drug : this.repository.findDrugs()) {
      if (drug != null && drug.active && categories.containsKey(drug.categoryId)) {
        drugs.put(drug.id, drug);
      }
    }

    int skipped = 0;
    for (DarkKeywordKeyword keyword : this.repository.findKeywords()) {
      if (keyword == null || !keyword.active) continue;
      DarkKeywordDrug drug = drugs.get(keyword.drugId);
      if (drug == null) {
        ++skipped;
        continue;
      }
      DarkKeywordCategory category = categories.get(drug.categoryId);
      DarkKeywordPayload payload = new DarkKeywordPayload(
          keyword.id, drug.id, drug.getLabel(), category.id, category.name,
          keyword.weight);
      addKeyword(entries, keyword.keyword, payload);
    }
    if (skipped > 0) {
      log.debug("Skipped {} active keywords of inactive drugs or categories",
                skipped);
    }
  }
}
