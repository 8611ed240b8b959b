package com.jobtrail.dedup.tracking.util;

import java.util.List;

public final class TextSimilarity {
  private TextSimilarity() {}

  /**
   * 1 - levenshtein(a, b) / max(len). Blank input on either side scores 0.
   */
  public static double normalizedEditSimilarity(String a, String b) {
    if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    if (a.equals(b)) {
      return 1.0;
    }
    int maxLength = Math.max(a.length(), b.length());
    return 1.0 - ((double) levenshtein(a, b) / maxLength);
  }

  /**
   * Position-by-position edit similarity of two token lists: 1 - sum(levenshtein) / sum(max
   * token length). Lists of different size, or any token pair below {@code minTokenSimilarity},
   * score 0.
   */
  public static double tokenEditSimilarity(List<String> a, List<String> b, double minTokenSimilarity) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    int distance = 0;
    int length = 0;
    for (int i = 0; i < a.size(); i++) {
      String left = a.get(i);
      String right = b.get(i);
      if (normalizedEditSimilarity(left, right) < minTokenSimilarity) {
        return 0.0;
      }
      distance += levenshtein(left, right);
      length += Math.max(left.length(), right.length());
    }
    return 1.0 - ((double) distance / length);
  }

  public static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        int cost = ca == b.charAt(j - 1) ? 0 : 1;
        current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
