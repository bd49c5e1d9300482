package com.foo.sheets.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NumericCellParserTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "1,234.5%|1234.5",
        "-3|-3.0",
        "10%|10.0",
        "  42  |42.0",
        "1e3|1000.0",
        ".5|0.5",
        "+7|7.0",
        "12 %|12.0",
        "1_000|1000.0",
        "1_000.25|1000.25",
        "1.|1.0"
      })
  void parse_numericText(String raw, double expected) {
    assertThat(NumericCellParser.parse(raw)).hasValue(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "abc", "1d", "0x1p3", "%", "10%%", "1.2.3", "N/A", "_1", "1_",
      "1__0", "1_.5"})
  void parse_nonNumericText_isEmpty(String raw) {
    assertThat(NumericCellParser.parse(raw)).isEmpty();
  }

  @Test
  void parse_null_isEmpty() {
    assertThat(NumericCellParser.parse(null)).isEmpty();
  }

  @Test
  void parse_nonBreakingSpaces_areStripped() {
    assertThat(NumericCellParser.parse("\u00a012\u00a0")).hasValue(12.0);
    assertThat(NumericCellParser.parse("\u202f50%\u2007")).hasValue(50.0);
    assertThat(NumericCellParser.parse("\u00a0")).isEmpty();
  }

  @Test
  void parse_infinityAndNan() {
    assertThat(NumericCellParser.parse("inf")).hasValue(Double.POSITIVE_INFINITY);
    assertThat(NumericCellParser.parse("-Infinity")).hasValue(Double.NEGATIVE_INFINITY);
    assertThat(NumericCellParser.parse("NaN").getAsDouble()).isNaN();
  }

  @Test
  void parseOrZero_nonNumeric_returnsZero() {
    assertThat(NumericCellParser.parseOrZero("abc")).isEqualTo(0.0);
    assertThat(NumericCellParser.parseOrZero("2,000")).isEqualTo(2000.0);
  }
}
