package com.foo.sheets.model;

/** 기본 (그룹 컬럼, 집계 컬럼) 쌍. 데이터가 없으면 둘 다 null. */
public record ColumnSelection(String groupByColumn, String aggregateColumn) {

  private static final ColumnSelection NONE = new ColumnSelection(null, null);

  public static ColumnSelection none() {
    return NONE;
  }
}
