package com.foo.sheets.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CSV 한 번 수집의 결과. 모든 행은 생성 시 헤더 길이에 맞춰 정규화된다.
 *
 * <p>생성 후 변경되지 않는다.
 */
public record SheetDataset(List<String> headers, List<List<String>> rows) {

  public SheetDataset {
    headers = List.copyOf(headers);
    int width = headers.size();
    rows = rows.stream().map(row -> normalize(row, width)).toList();
  }

  public static SheetDataset empty() {
    return new SheetDataset(List.of(), List.of());
  }

  /** 같은 이름의 헤더가 여러 개면 첫 번째 인덱스. 없으면 -1. */
  public int indexOf(String columnName) {
    return columnName == null ? -1 : headers.indexOf(columnName);
  }

  public boolean hasNoData() {
    return headers.isEmpty() || rows.isEmpty();
  }

  public int columnCount() {
    return headers.size();
  }

  public int rowCount() {
    return rows.size();
  }

  /** 헤더 길이에 맞춰 빈 문자열로 채우거나 잘라낸다. */
  private static List<String> normalize(List<String> row, int width) {
    List<String> normalized = new ArrayList<>(row.subList(0, Math.min(row.size(), width)));
    normalized.addAll(Collections.nCopies(width - normalized.size(), ""));
    return List.copyOf(normalized);
  }
}
