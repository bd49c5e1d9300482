package com.foo.sheets.controller;

import com.foo.sheets.service.fetch.SheetFetchException;
import jakarta.validation.ConstraintViolationException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

@Slf4j
@RestControllerAdvice(basePackageClasses = SheetSummaryApiController.class)
public class SheetApiExceptionHandler {

  @ExceptionHandler(SheetFetchException.class)
  public ResponseEntity<Map<String, Object>> handleFetch(SheetFetchException e) {
    HttpStatus status = switch (e.getKind()) {
      case INVALID_ARGUMENTS -> HttpStatus.BAD_REQUEST;
      case TRANSPORT -> HttpStatus.BAD_GATEWAY;
      case NETWORK -> HttpStatus.GATEWAY_TIMEOUT;
    };
    log.warn("시트 조회 실패 ({}): {}", e.getKind(), e.getMessage());
    return ResponseEntity.status(status).body(errorBody(e.toKoreanMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
    log.warn("요청 오류: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
  }

  @ExceptionHandler({
      MissingServletRequestParameterException.class,
      HandlerMethodValidationException.class,
      ConstraintViolationException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadParameter(Exception e) {
    log.warn("요청 파라미터 오류: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody("요청 파라미터가 올바르지 않습니다."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
    log.error("시트 요약 처리 실패", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(errorBody("시트 처리 중 오류가 발생했습니다. 관리자에게 문의하세요."));
  }

  private Map<String, Object> errorBody(String message) {
    return Map.of("success", false, "message", message);
  }
}
