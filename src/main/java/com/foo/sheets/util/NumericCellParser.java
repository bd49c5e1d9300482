package com.foo.sheets.util;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * 셀 문자열을 숫자로 해석한다. 천 단위 구분자(,)와 끝의 퍼센트 기호 하나를 허용한다.
 *
 * <p>모든 숫자 비율 계산과 집계는 이 클래스를 거쳐야 한다.
 */
public final class NumericCellParser {

  // 숫자 사이의 밑줄 하나는 자릿수 구분으로 허용한다 (1_000)
  private static final String DIGITS = "\\d(?:_?\\d)*";

  // Double.parseDouble 은 "1d", 16진수 리터럴도 받아들이므로 먼저 형식을 확인한다
  private static final Pattern DECIMAL = Pattern.compile(
      "[+-]?(" + DIGITS + "(\\.(" + DIGITS + ")?)?|\\." + DIGITS + ")([eE][+-]?" + DIGITS + ")?");

  private NumericCellParser() {}

  public static OptionalDouble parse(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    String text = CellText.strip(raw);
    if (text.isEmpty()) {
      return OptionalDouble.empty();
    }
    if (text.endsWith("%")) {
      text = text.substring(0, text.length() - 1);
    }
    text = CellText.strip(text.replace(",", ""));

    if (DECIMAL.matcher(text).matches()) {
      return OptionalDouble.of(Double.parseDouble(text.replace("_", "")));
    }
    return special(text);
  }

  public static boolean isNumeric(String raw) {
    return parse(raw).isPresent();
  }

  /** parse 결과가 없으면 0.0 */
  public static double parseOrZero(String raw) {
    return parse(raw).orElse(0.0);
  }

  private static OptionalDouble special(String text) {
    boolean negative = text.startsWith("-");
    String body = negative || text.startsWith("+") ? text.substring(1) : text;
    return switch (body.toLowerCase(Locale.ROOT)) {
      case "inf", "infinity" ->
          OptionalDouble.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
      case "nan" -> OptionalDouble.of(Double.NaN);
      default -> OptionalDouble.empty();
    };
  }
}
