package io.github.behaviorcache.converter;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Types a raw CSV cell as null, Long, Double, Boolean or String.
 */
public class ScalarCellParser {

  private static final Set<String> NULL_EQUIVALENTS =
      Set.of("", "nan", "NaN", "NA", "N/A", "null", "NULL", "None", "<NA>");
  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

  /**
   * Parse a cell.
   *
   * @param cell the raw cell text, possibly null
   * @return the typed value
   */
  public Object parse(final String cell) {
    if (cell == null) {
      return null;
    }
    final String text = cell.trim();
    if (NULL_EQUIVALENTS.contains(text)) {
      return null;
    }
    if (INTEGER.matcher(text).matches()) {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        // wider than a long, keep the text
        return text;
      }
    }
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    if ("True".equals(text) || "true".equals(text)) {
      return Boolean.TRUE;
    }
    if ("False".equals(text) || "false".equals(text)) {
      return Boolean.FALSE;
    }
    return cell;
  }
}
