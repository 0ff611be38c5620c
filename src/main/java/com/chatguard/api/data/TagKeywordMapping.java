package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

public class TagKeywordMapping {
  public long id;
  @SerializedName("tag_id")
  public long tagId;
  public String keyword;
  @SerializedName("is_active")
  public boolean active = true;
  @SerializedName("auto_focus")
  public boolean autoFocus;
}
