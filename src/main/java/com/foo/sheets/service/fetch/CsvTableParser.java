package com.foo.sheets.service.fetch;

import com.foo.sheets.model.SheetDataset;
import com.foo.sheets.util.CellText;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CsvTableParser {

  /** 잘못된 UTF-8 바이트는 U+FFFD 로 치환된다. */
  public SheetDataset parse(byte[] body) {
    return parse(new String(body, StandardCharsets.UTF_8));
  }

  public SheetDataset parse(String csvText) {
    List<String[]> table = readAll(csvText);
    if (table.isEmpty()) {
      return SheetDataset.empty();
    }

    List<String> headers = Arrays.stream(table.get(0)).map(CellText::strip).toList();
    List<List<String>> rows = new ArrayList<>();
    int skipped = 0;
    for (String[] cells : table.subList(1, table.size())) {
      if (isBlankRow(cells)) {
        skipped++;
        continue;
      }
      rows.add(Arrays.asList(cells));
    }

    log.debug("Parsed CSV: {} columns, {} rows, {} blank rows skipped",
        headers.size(), rows.size(), skipped);
    return new SheetDataset(headers, rows);
  }

  private List<String[]> readAll(String csvText) {
    // RFC 4180: 따옴표 두 개로 이스케이프, 백슬래시는 일반 문자
    try (CSVReader reader =
        new CSVReaderBuilder(new StringReader(csvText))
            .withCSVParser(new RFC4180ParserBuilder().build())
            .build()) {
      return reader.readAll();
    } catch (IOException | CsvException e) {
      log.debug("RFC 4180 parse failed, re-reading leniently: {}", e.getMessage());
      return LenientCsvTokenizer.tokenize(csvText);
    }
  }

  private boolean isBlankRow(String[] cells) {
    for (String cell : cells) {
      if (!CellText.isBlank(cell)) {
        return false;
      }
    }
    return true;
  }
}
