package com.foo.sheets.util;

/**
 * 셀 문자열의 공백 처리. {@link String#strip()} 과 달리 NBSP(U+00A0), U+2007, U+202F, NEL(U+0085)
 * 도 공백으로 본다.
 */
public final class CellText {

  private CellText() {}

  public static boolean isWhitespace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
  }

  public static String strip(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isWhitespace(value.charAt(start))) {
      start++;
    }
    while (end > start && isWhitespace(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  public static boolean isBlank(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (!isWhitespace(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
