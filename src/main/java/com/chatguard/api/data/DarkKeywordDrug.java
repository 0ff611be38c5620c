package com.chatguard.api.data;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.annotations.SerializedName;

public class DarkKeywordDrug {
  public long id;
  @SerializedName("category_id")
  public long categoryId;
  public String name;
  @SerializedName("display_name")
  public String displayName;
  @SerializedName("is_active")
  public boolean active = true;

  /** Display name if set, otherwise the plain name. */
  public String getLabel() {
    return StringUtils.isNotBlank(this.displayName) ? this.displayName : this.name;
  }
}
