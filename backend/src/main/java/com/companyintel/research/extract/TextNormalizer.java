package com.companyintel.research.extract;

import java.util.StringJoiner;
import java.util.regex.Pattern;

final class TextNormalizer {
  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u200B]+");

  private TextNormalizer() {}

  static String collapseInline(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  static String collapseLines(String text) {
    if (text == null) {
      return "";
    }
    StringJoiner joiner = new StringJoiner("\n");
    for (String line : text.split("\\R")) {
      String collapsed = collapseInline(line);
      if (!collapsed.isEmpty()) {
        joiner.add(collapsed);
      }
    }
    return joiner.toString();
  }
}
