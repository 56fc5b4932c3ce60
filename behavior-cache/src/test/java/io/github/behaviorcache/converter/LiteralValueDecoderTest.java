package io.github.behaviorcache.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.behaviorcache.exception.DecodeException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LiteralValueDecoderTest {

  private final LiteralValueDecoder decoder = new LiteralValueDecoder();

  @Test
  void decode_singleQuotedStringList() {
    assertThat(decoder.decode("['Sst-IRES-Cre']")).isEqualTo(List.of("Sst-IRES-Cre"));
  }

  @Test
  void decode_integerList() {
    assertThat(decoder.decode("[951980471, 951980473]"))
        .isEqualTo(List.of(951980471L, 951980473L));
  }

  @Test
  void decode_tupleBecomesList() {
    assertThat(decoder.decode("(1, 2,)")).isEqualTo(List.of(1L, 2L));
  }

  @Test
  void decode_pythonKeywords() {
    final Object decoded = decoder.decode("{'a': None, 'b': True, 'c': False, 'd': 1.5}");

    assertThat(decoded).isInstanceOf(Map.class);
    final Map<?, ?> map = (Map<?, ?>) decoded;
    assertThat(map.get("a")).isNull();
    assertThat(map.get("b")).isEqualTo(true);
    assertThat(map.get("c")).isEqualTo(false);
    assertThat(map.get("d")).isEqualTo(1.5);
  }

  @Test
  void decode_keywordsInsideStringsAreKept() {
    assertThat(decoder.decode("['None of (these)', \"True\"]"))
        .isEqualTo(List.of("None of (these)", "True"));
  }

  @Test
  void decode_nanIsDouble() {
    final List<?> decoded = (List<?>) decoder.decode("[nan, 1]");

    assertThat((Double) decoded.get(0)).isNaN();
  }

  @Test
  void decode_nonStringDictKeysBecomeText() {
    assertThat(decoder.decode("{1: 'a', -2: 'b', None: [1, 2]}"))
        .isEqualTo(Map.of("1", "a", "-2", "b", "None", List.of(1L, 2L)));
  }

  @Test
  void decode_setBecomesList() {
    assertThat(decoder.decode("{1, 2}")).isEqualTo(List.of(1L, 2L));
    assertThat(decoder.decode("{'plane': {3, 4}, 'depth': 175}"))
        .isEqualTo(Map.of("plane", List.of(3L, 4L), "depth", 175L));
  }

  @Test
  void decode_emptyDict() {
    assertThat(decoder.decode("{}")).isEqualTo(Map.of());
  }

  @Test
  void decode_resultIsUnmodifiable() {
    final List<?> decoded = (List<?>) decoder.decode("[[1], [2]]");

    assertThatThrownBy(() -> ((List<Object>) decoded).add(3))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {"['unterminated]", "[1, 2", "[1] [2]", "{'a' 1}"})
  void decode_malformedTextFails(final String text) {
    assertThatThrownBy(() -> decoder.decode(text))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Malformed literal");
  }
}
