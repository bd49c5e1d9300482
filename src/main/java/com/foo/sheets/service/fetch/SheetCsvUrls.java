package com.foo.sheets.service.fetch;

import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/**
 * 스프레드시트 CSV 내보내기 URL. 인자는 unreserved 문자를 제외하고 모두 퍼센트 인코딩한다.
 */
public final class SheetCsvUrls {

  private static final String BASE = "https://docs.google.com/spreadsheets/d/";

  private SheetCsvUrls() {}

  /** 시트가 웹에 게시되었거나 공개 공유되어 있어야 한다. */
  public static String byName(String sheetId, String sheetName) {
    return BASE + sheetId + "/gviz/tq?tqx=out:csv&sheet=" + encode(sheetName);
  }

  /** 탭 이름을 모를 때도 동작한다. */
  public static String byGid(String sheetId, String gid) {
    return BASE + sheetId + "/export?format=csv&gid=" + encode(gid);
  }

  /** gid 가 있으면 항상 gid 형식을 쓴다. null 과 빈 문자열은 지정되지 않은 것으로 본다. */
  public static String forRequest(String sheetId, String sheetName, String gid) {
    if (gid != null && !gid.isEmpty()) {
      return byGid(sheetId, gid);
    }
    if (sheetName == null || sheetName.isEmpty()) {
      throw SheetFetchException.invalidArguments();
    }
    return byName(sheetId, sheetName);
  }

  private static String encode(String value) {
    return UriUtils.encode(value, StandardCharsets.UTF_8);
  }
}
