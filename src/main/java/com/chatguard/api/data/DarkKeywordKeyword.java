package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

public class DarkKeywordKeyword {
  public long id;
  @SerializedName("drug_id")
  public long drugId;
  public String keyword;
  public int weight = 1;
  @SerializedName("is_active")
  public boolean active = true;
}
