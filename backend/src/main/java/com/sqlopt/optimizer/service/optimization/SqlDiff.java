package com.sqlopt.optimizer.service.optimization;

import java.util.Arrays;
import java.util.List;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

/** Context-free unified line diff between the original and the rewritten query. */
public final class SqlDiff {

  static final String ORIGINAL_LABEL = "original.sql";
  static final String OPTIMIZED_LABEL = "optimized.sql";

  private SqlDiff() {}

  /** Empty when both texts have the same lines. */
  public static String unified(String original, String optimized) {
    List<String> before = lines(original);
    List<String> after = lines(optimized);
    Patch<String> patch = DiffUtils.diff(before, after);
    if (patch.getDeltas().isEmpty()) {
      return "";
    }
    return String.join(
        "\n",
        UnifiedDiffUtils.generateUnifiedDiff(ORIGINAL_LABEL, OPTIMIZED_LABEL, before, patch, 0));
  }

  private static List<String> lines(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(text.split("\\R"));
  }
}
