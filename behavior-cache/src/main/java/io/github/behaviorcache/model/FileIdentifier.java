package io.github.behaviorcache.model;

import java.math.BigDecimal;
import org.immutables.value.Value;

/**
 * Opaque key of one downloadable data file.
 */
@Value.Immutable
public interface FileIdentifier {

  /**
   * Canonical text form.
   */
  @Value.Parameter
  String value();

  /**
   * Builds an identifier from a table cell. Integral numbers written as floats ("1234.0") are
   * reduced to their integer text.
   *
   * @param cell the cell value
   * @return the file identifier
   */
  static FileIdentifier of(final Object cell) {
    if (cell instanceof Long || cell instanceof Integer) {
      return ImmutableFileIdentifier.of(cell.toString());
    }
    if (cell instanceof Number) {
      return ImmutableFileIdentifier.of(canonical(new BigDecimal(cell.toString())));
    }
    final String text = String.valueOf(cell).trim();
    try {
      return ImmutableFileIdentifier.of(canonical(new BigDecimal(text)));
    } catch (NumberFormatException e) {
      return ImmutableFileIdentifier.of(text);
    }
  }

  private static String canonical(final BigDecimal number) {
    final BigDecimal stripped = number.stripTrailingZeros();
    return stripped.scale() <= 0 ? stripped.toBigInteger().toString() : stripped.toPlainString();
  }

  /**
   * Rejects blank identifiers.
   */
  @Value.Check
  default void check() {
    if (value().isBlank()) {
      throw new IllegalArgumentException("File identifier must not be blank");
    }
  }
}
