package com.foo.sheets.service.fetch;

import java.util.ArrayList;
import java.util.List;

/**
 * RFC 4180 파서가 거부하는 CSV 를 관대하게 읽는다.
 *
 * <ul>
 *   <li>닫는 따옴표 뒤의 문자는 같은 필드에 이어 붙인다: {@code "ab"cd} → {@code abcd}
 *   <li>따옴표로 시작하지 않은 필드 안의 따옴표는 일반 문자다.
 *   <li>파일 끝까지 닫히지 않은 따옴표 필드는 모은 내용(줄바꿈 포함)을 그대로 필드로 쓴다.
 * </ul>
 *
 * 빈 줄은 빈 레코드가 된다.
 */
final class LenientCsvTokenizer {

  private enum State {
    START_RECORD,
    START_FIELD,
    IN_FIELD,
    IN_QUOTED_FIELD,
    QUOTE_IN_QUOTED_FIELD
  }

  private static final char SEPARATOR = ',';
  private static final char QUOTE = '"';

  private final String text;
  private final List<String[]> records = new ArrayList<>();
  private final List<String> fields = new ArrayList<>();
  private final StringBuilder field = new StringBuilder();
  private State state = State.START_RECORD;

  private LenientCsvTokenizer(String text) {
    this.text = text;
  }

  static List<String[]> tokenize(String text) {
    return new LenientCsvTokenizer(text).run();
  }

  private List<String[]> run() {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      boolean newline = c == '\n' || c == '\r';
      // \r\n 은 줄바꿈 하나
      if (c == '\r' && state != State.IN_QUOTED_FIELD
          && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
        i++;
      }

      switch (state) {
        case START_RECORD -> {
          if (newline) {
            endRecord();
          } else {
            startField(c);
          }
        }
        case START_FIELD -> {
          if (newline) {
            saveField();
            endRecord();
          } else {
            startField(c);
          }
        }
        case IN_FIELD -> {
          if (newline) {
            saveField();
            endRecord();
          } else if (c == SEPARATOR) {
            saveField();
            state = State.START_FIELD;
          } else {
            field.append(c);
          }
        }
        case IN_QUOTED_FIELD -> {
          if (c == QUOTE) {
            state = State.QUOTE_IN_QUOTED_FIELD;
          } else {
            field.append(c);
          }
        }
        case QUOTE_IN_QUOTED_FIELD -> {
          if (c == QUOTE) {
            field.append(QUOTE);
            state = State.IN_QUOTED_FIELD;
          } else if (c == SEPARATOR) {
            saveField();
            state = State.START_FIELD;
          } else if (newline) {
            saveField();
            endRecord();
          } else {
            field.append(c);
            state = State.IN_FIELD;
          }
        }
      }
    }

    if (state != State.START_RECORD) {
      saveField();
      endRecord();
    }
    return records;
  }

  private void startField(char c) {
    if (c == QUOTE) {
      state = State.IN_QUOTED_FIELD;
    } else if (c == SEPARATOR) {
      saveField();
      state = State.START_FIELD;
    } else {
      field.append(c);
      state = State.IN_FIELD;
    }
  }

  private void saveField() {
    fields.add(field.toString());
    field.setLength(0);
  }

  private void endRecord() {
    records.add(fields.toArray(new String[0]));
    fields.clear();
    state = State.START_RECORD;
  }
}
