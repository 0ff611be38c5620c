package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

public class DarkKeywordCategory {
  public long id;
  public String name;
  @SerializedName("is_active")
  public boolean active = true;
}
