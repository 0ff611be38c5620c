package com.chatguard.nlp.source;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.chatguard.api.data.TransactionMethodConfig;
import com.chatguard.api.data.TransactionMethodKeyword;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.api.repository.TransactionMethodRepository;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.nlp.payload.TransactionMethodPayload;

/**
 * One entry per active keyword of every active transaction method.
 */
public class TransactionMethodKeywordSource
    extends AbstractKeywordSource<TransactionMethodPayload> {

  private final TransactionMethodRepository repository;

  public TransactionMethodKeywordSource(TransactionMethodRepository repository) {
    super(KeywordDomain.TRANSACTION_METHOD);
    this.repository = checkNotNull(repository, "repository cannot be null");
  }

  @Override
  protected void collect(List<KeywordEntry<TransactionMethodPayload>> entries)
      throws KeywordSourceException {
    for (TransactionMethodConfig method : this.repository.findMethods()) {
      if (method == null || !method.active || method.keywords == null) continue;
      if (StringUtils.isBlank(method.methodName)) continue;

      TransactionMethodPayload payload =
          new TransactionMethodPayload(method.methodName.trim());
      for (TransactionMethodKeyword keyword : method.keywords) {
        if (keyword == null || !keyword.active) continue;
        addKeyword(entries, keyword.keyword, payload);
      }
    }
  }
}
