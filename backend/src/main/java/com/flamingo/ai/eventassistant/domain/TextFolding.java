package com.flamingo.ai.eventassistant.domain;

import java.util.Locale;

/** Case folding for user text and catalog values that also handles the Turkish dotted I. */
public final class TextFolding {

  private TextFolding() {}

  /** Lower-cases, strips the combining dot left behind by "İ", and trims. Null becomes "". */
  public static String fold(String text) {
    if (text == null) {
      return "";
    }
    return text.replace('\u0130', 'i')
        .replace('I', 'i')
        .toLowerCase(Locale.ROOT)
        .replace("\u0307", "")
        .trim();
  }

  /** Case-insensitive substring test; a blank needle never matches. */
  public static boolean containsFolded(String haystack, String needle) {
    String n = fold(needle);
    return !n.isEmpty() && fold(haystack).contains(n);
  }
}
