package com.chatguard.nlp.payload;

import static com.google.common.base.Preconditions.checkNotNull;

public final class TransactionMethodPayload implements MatchPayload {
  private final String methodName;

  public TransactionMethodPayload(String methodName) {
    this.methodName = checkNotNull(methodName, "methodName cannot be null");
  }

  @Override
  public KeywordDomain getDomain() {
    return KeywordDomain.TRANSACTION_METHOD;
  }

  public String getMethodName() {
    return this.methodName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TransactionMethodPayload)) return false;
    return this.methodName.equals(((TransactionMethodPayload) o).methodName);
  }

  @Override
  public int hashCode() {
    return this.methodName.hashCode();
  }

  @Override
  public String toString() {
    return "method=" + this.methodName;
  }
}
