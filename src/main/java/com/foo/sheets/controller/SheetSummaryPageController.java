package com.foo.sheets.controller;

import com.foo.sheets.service.SheetQuery;
import com.foo.sheets.service.SheetSummaryService;
import com.foo.sheets.service.fetch.SheetFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Slf4j
@Controller
@RequiredArgsConstructor
public class SheetSummaryPageController {

  private final SheetSummaryService summaryService;

  @GetMapping("/sheets")
  public String summary(
      @RequestParam(required = false) String sheetId,
      @RequestParam(required = false) String sheetName,
      @RequestParam(required = false) String gid,
      @RequestParam(required = false) String groupBy,
      @RequestParam(required = false) String aggregate,
      @RequestParam(defaultValue = "sum") String agg,
      Model model) {
    try {
      SheetQuery query = new SheetQuery(sheetId, sheetName, gid, null);
      model.addAttribute("summary", summaryService.summarize(query, groupBy, aggregate, agg));
    } catch (SheetFetchException e) {
      log.warn("시트 조회 실패 ({}): {}", e.getKind(), e.getMessage());
      model.addAttribute("errorMessage", e.toKoreanMessage());
    } catch (IllegalArgumentException e) {
      log.warn("요청 오류: {}", e.getMessage());
      model.addAttribute("errorMessage", e.getMessage());
    } catch (Exception e) {
      log.error("시트 요약 처리 실패", e);
      model.addAttribute("errorMessage", "시트 처리 중 오류가 발생했습니다. 관리자에게 문의하세요.");
    }
    return "sheet-summary";
  }
}
