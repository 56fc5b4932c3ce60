package io.github.behaviorcache.table;

import io.github.behaviorcache.converter.LiteralValueDecoder;
import io.github.behaviorcache.exception.DecodeException;
import java.util.Map;
import java.util.Set;

/**
 * Base normalization: decodes every non-null text cell of the structured columns. Cells already
 * typed as scalars are left alone.
 */
public class StructuredColumnDecoder implements RowNormalizer {

  private final Set<String> structuredColumns;
  private final LiteralValueDecoder decoder;

  /**
   * Instantiates a new Structured column decoder.
   *
   * @param structuredColumns the structured columns
   * @param decoder           the decoder
   */
  public StructuredColumnDecoder(final Set<String> structuredColumns,
                                 final LiteralValueDecoder decoder) {
    this.structuredColumns = Set.copyOf(structuredColumns);
    this.decoder = decoder;
  }

  @Override
  public Map<String, Object> normalize(final Map<String, Object> row) {
    for (String column : structuredColumns) {
      final Object value = row.get(column);
      if (value instanceof String) {
        try {
          row.put(column, decoder.decode((String) value));
        } catch (DecodeException e) {
          throw new DecodeException("column " + column + ": " + e.getMessage(), e);
        }
      }
    }
    return row;
  }
}
