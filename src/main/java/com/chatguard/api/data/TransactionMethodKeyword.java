package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

public class TransactionMethodKeyword {
  public long id;
  public String keyword;
  @SerializedName("is_active")
  public boolean active = true;
}
