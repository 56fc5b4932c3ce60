package io.github.behaviorcache.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.behaviorcache.exception.DecodeException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the literal text the metadata tables use for list and dict cells, e.g.
 * {@code "['Sst-IRES-Cre']"} or {@code "[1, 2, 3]"}.
 *
 * <p>The text is rewritten token-wise into lenient JSON (tuples and sets become lists, {@code None},
 * {@code True}, {@code False}, {@code nan} and {@code inf} become their JSON spellings, and dict
 * keys that are not strings are quoted, so {@code {1: 'a'}} decodes to a map keyed by
 * {@code "1"}) and parsed with a Jackson mapper that accepts single quotes, trailing commas and
 * non-numeric numbers. Decoded structures are unmodifiable.
 */
public class LiteralValueDecoder {

  private static final Map<String, String> KEYWORDS = Map.of(
      "None", "null",
      "True", "true",
      "False", "false",
      "nan", "NaN",
      "inf", "Infinity");

  private final ObjectMapper literalMapper;

  /**
   * Instantiates a new Literal value decoder.
   */
  public LiteralValueDecoder() {
    this.literalMapper = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
        .enable(DeserializationFeature.USE_LONG_FOR_INTS)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();
  }

  /**
   * Decode one cell.
   *
   * @param text the literal text
   * @return a List, Map, String, Long, Double, Boolean or null
   * @throws DecodeException if the text is not a supported literal
   */
  public Object decode(final String text) {
    final String json;
    try {
      json = toJson(text);
    } catch (IllegalArgumentException e) {
      throw new DecodeException("Malformed literal '" + text + "': " + e.getMessage(), e);
    }
    try {
      return freeze(literalMapper.readValue(json, Object.class));
    } catch (JsonProcessingException e) {
      throw new DecodeException("Malformed literal '" + text + "': " + e.getOriginalMessage(), e);
    }
  }

  private static String toJson(final String text) {
    final StringBuilder out = new StringBuilder(text.length() + 8);
    // innermost open bracket: '{' dict, 's' set, '[' list or tuple
    final Deque<Character> open = new ArrayDeque<>();
    boolean expectKey = false;
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (expectKey && !Character.isWhitespace(c) && c != '}') {
        expectKey = false;
        if (c != '\'' && c != '"') {
          // non-string keys are kept as their text
          final int colon = endOfKey(text, i);
          out.append('"').append(text.substring(i, colon).trim()).append('"');
          i = colon;
          continue;
        }
      }
      if (c == '\'' || c == '"') {
        final int end = endOfString(text, i);
        out.append(text, i, end);
        i = end;
      } else if (c == '{') {
        final boolean dict = isDict(text, i);
        open.push(dict ? '{' : 's');
        out.append(dict ? '{' : '[');
        expectKey = dict;
        i++;
      } else if (c == '}') {
        out.append(open.isEmpty() || open.pop() == '{' ? '}' : ']');
        expectKey = false;
        i++;
      } else if (c == '(' || c == '[') {
        open.push('[');
        out.append('[');
        i++;
      } else if (c == ')' || c == ']') {
        if (!open.isEmpty()) {
          open.pop();
        }
        out.append(']');
        i++;
      } else if (c == ',') {
        expectKey = !open.isEmpty() && open.peek() == '{';
        out.append(c);
        i++;
      } else if (Character.isLetter(c) || c == '_') {
        int end = i + 1;
        while (end < text.length()
            && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
          end++;
        }
        final String word = text.substring(i, end);
        out.append(KEYWORDS.getOrDefault(word, word));
        i = end;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  /**
   * Whether the brace at {@code start} opens a dict (empty, or with a colon at its own level)
   * rather than a set.
   */
  private static boolean isDict(final String text, final int start) {
    int depth = 0;
    int i = start + 1;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (c == '\'' || c == '"') {
        i = endOfString(text, i);
        continue;
      }
      if (c == '{' || c == '[' || c == '(') {
        depth++;
      } else if (c == '}' || c == ']' || c == ')') {
        if (depth == 0) {
          return text.substring(start + 1, i).isBlank();
        }
        depth--;
      } else if (c == ':' && depth == 0) {
        return true;
      }
      i++;
    }
    throw new IllegalArgumentException("unbalanced '{' at offset " + start);
  }

  private static int endOfKey(final String text, final int start) {
    int depth = 0;
    for (int i = start; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '(' || c == '[') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
      } else if (depth == 0 && c == ':') {
        return i;
      } else if (depth == 0 && (c == ',' || c == '}')) {
        break;
      }
    }
    throw new IllegalArgumentException("dict key without value at offset " + start);
  }

  private static int endOfString(final String text, final int start) {
    final char quote = text.charAt(start);
    int i = start + 1;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) {
        return i + 1;
      }
      i++;
    }
    throw new IllegalArgumentException("unterminated string starting at offset " + start);
  }

  @SuppressWarnings("unchecked")
  private static Object freeze(final Object value) {
    if (value instanceof List) {
      final List<Object> copy = new ArrayList<>();
      for (Object item : (List<Object>) value) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Map) {
      final Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
        copy.put(entry.getKey(), freeze(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    return value;
  }
}
