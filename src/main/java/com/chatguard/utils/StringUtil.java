package com.chatguard.utils;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class StringUtil {
  private static final Splitter COMMA_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();
  private static Gson gson = null;

  public static synchronized Gson getGsonInstance() {
    if (gson == null) {
      gson = new GsonBuilder().disableHtmlEscaping().create();
    }
    return gson;
  }

  /**
   * Splits a comma separated list, dropping blank items. Null or blank input
   * yields an empty list.
   */
  public static List<String> splitCommaList(String s) {
    if (StringUtils.isBlank(s)) return ImmutableList.of();
    return COMMA_SPLITTER.splitToList(s);
  }

  public static String toJson(Object o) {
    return getGsonInstance().toJson(o);
  }

  private StringUtil() {
  }
}
