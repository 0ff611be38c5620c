package com.chatguard.api.repository;

import java.util.List;

import com.chatguard.api.data.DarkKeywordCategory;
import com.chatguard.api.data.DarkKeywordDrug;
import com.chatguard.api.data.DarkKeywordKeyword;

/**
 * The three levels of restricted-vocabulary configuration: categories, drugs
 * within a category, and keywords for a drug.
 */
public interface DarkKeywordRepository {
  public List<DarkKeywordCategory> findCategories() throws KeywordSourceException;
  public List<DarkKeywordDrug> findDrugs() throws KeywordSourceException;
  public List<DarkKeywordKeyword> findKeywords() throws KeywordSourceException;
}
