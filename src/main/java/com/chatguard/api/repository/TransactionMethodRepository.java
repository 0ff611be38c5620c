package com.chatguard.api.repository;

import java.util.List;

import com.chatguard.api.data.TransactionMethodConfig;

public interface TransactionMethodRepository {
  /** Returns all method configs, each with its keywords. */
  public List<TransactionMethodConfig> findMethods() throws KeywordSourceException;
}
