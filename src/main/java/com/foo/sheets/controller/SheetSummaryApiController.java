package com.foo.sheets.controller;

import com.foo.sheets.service.SheetQuery;
import com.foo.sheets.service.SheetSummaryService;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequiredArgsConstructor
public class SheetSummaryApiController {

  private final SheetSummaryService summaryService;

  @GetMapping("/api/sheets/summary")
  public ResponseEntity<Map<String, Object>> summary(
      @RequestParam(required = false) String sheetId,
      @RequestParam(required = false) String sheetName,
      @RequestParam(required = false) String gid,
      @RequestParam(required = false) String groupBy,
      @RequestParam(required = false) String aggregate,
      @RequestParam(defaultValue = "sum") String agg,
      @RequestParam(required = false) @Positive Integer timeoutSeconds) {
    SheetQuery query = new SheetQuery(sheetId, sheetName, gid, timeoutSeconds);
    var summary = summaryService.summarize(query, groupBy, aggregate, agg);
    return ResponseEntity.ok(summaryService.toApiResponse(summary));
  }

  @GetMapping("/api/sheets/rows")
  public ResponseEntity<Map<String, Object>> rows(
      @RequestParam(required = false) String sheetId,
      @RequestParam(required = false) String sheetName,
      @RequestParam(required = false) String gid,
      @RequestParam String column,
      @RequestParam String value,
      @RequestParam(required = false) @Positive Integer timeoutSeconds) {
    SheetQuery query = new SheetQuery(sheetId, sheetName, gid, timeoutSeconds);
    return ResponseEntity.ok(summaryService.toApiResponse(summaryService.filter(query, column, value)));
  }
}
