package com.foo.sheets.service.analysis;

import com.foo.sheets.model.SheetDataset;
import com.foo.sheets.util.CellText;
import com.foo.sheets.util.NumericCellParser;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/** 앞쪽 sampleSize 행만 보고 계산한 컬럼 통계. */
public record ColumnStatistics(int columnIndex, double numericRatio, int cardinality) {

  public static ColumnStatistics of(SheetDataset dataset, int columnIndex, int sampleSize) {
    List<List<String>> sample = sample(dataset, sampleSize);
    int numeric = 0;
    Set<String> distinct = new HashSet<>();
    for (List<String> row : sample) {
      String cell = row.get(columnIndex);
      if (NumericCellParser.isNumeric(cell)) {
        numeric++;
      }
      String trimmed = CellText.strip(cell);
      if (!trimmed.isEmpty()) {
        distinct.add(trimmed);
      }
    }
    double ratio = sample.isEmpty() ? 0.0 : (double) numeric / sample.size();
    return new ColumnStatistics(columnIndex, ratio, distinct.size());
  }

  public static List<ColumnStatistics> allColumns(SheetDataset dataset, int sampleSize) {
    return IntStream.range(0, dataset.columnCount())
        .mapToObj(i -> of(dataset, i, sampleSize))
        .toList();
  }

  private static List<List<String>> sample(SheetDataset dataset, int sampleSize) {
    List<List<String>> rows = dataset.rows();
    return rows.subList(0, Math.min(rows.size(), sampleSize));
  }
}
