package com.foo.sheets.service.fetch;

import lombok.Getter;

@Getter
public class SheetFetchException extends RuntimeException {

  public enum Kind {
    INVALID_ARGUMENTS,
    TRANSPORT,
    NETWORK
  }

  private final Kind kind;
  /** TRANSPORT 일 때만 의미가 있다. 그 외에는 0. */
  private final int statusCode;
  private final String reason;

  private SheetFetchException(Kind kind, int statusCode, String reason, String message,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
    this.reason = reason;
  }

  public static SheetFetchException invalidArguments() {
    return new SheetFetchException(Kind.INVALID_ARGUMENTS, 0, null,
        "Either sheetName or gid must be provided", null);
  }

  public static SheetFetchException transport(int statusCode, String reason) {
    return new SheetFetchException(Kind.TRANSPORT, statusCode, reason,
        "HTTP error fetching sheet: %d %s".formatted(statusCode, reason), null);
  }

  public static SheetFetchException network(String reason, Throwable cause) {
    return new SheetFetchException(Kind.NETWORK, 0, reason,
        "Network error fetching sheet: " + reason, cause);
  }

  public String toKoreanMessage() {
    return switch (kind) {
      case INVALID_ARGUMENTS -> "시트 이름 또는 gid 중 하나는 필수입니다.";
      case TRANSPORT -> "시트를 가져오지 못했습니다. (HTTP %d %s)".formatted(statusCode, reason);
      case NETWORK -> "시트 서버에 연결하지 못했습니다: " + reason;
    };
  }
}
