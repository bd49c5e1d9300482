package com.foo.sheets.service;

import com.foo.sheets.config.SheetSourceProperties;

/** 가져올 시트. 비어 있는 값은 설정의 기본값으로 채운다. */
public record SheetQuery(String sheetId, String sheetName, String gid, Integer timeoutSeconds) {

  public SheetQuery withDefaults(SheetSourceProperties properties) {
    String resolvedId = isEmpty(sheetId) ? properties.getSheetId() : sheetId;
    boolean selectorGiven = !isEmpty(sheetName) || !isEmpty(gid);
    return new SheetQuery(
        resolvedId,
        selectorGiven ? sheetName : properties.getSheetName(),
        selectorGiven ? gid : properties.getGid(),
        timeoutSeconds != null ? timeoutSeconds : properties.getTimeoutSeconds());
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
