package com.chatguard.api.data;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * A configured transaction method (for example dead drop or courier) and the
 * keywords that indicate it.
 */
public class TransactionMethodConfig {
  public long id;
  @SerializedName("method_name")
  public String methodName;
  @SerializedName("is_active")
  public boolean active = true;
  public List<TransactionMethodKeyword> keywords = new ArrayList<>();
}
