package com.foo.sheets.service.analysis;

import com.foo.sheets.model.SheetDataset;
import com.foo.sheets.util.CellText;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class RowFilterService {

  /** 앞뒤 공백을 제거한 값이 정확히 같은 행만 원래 순서대로 반환한다. */
  public List<List<String>> filterRowsByValue(SheetDataset dataset, String columnName,
      String value) {
    if (dataset.hasNoData() || value == null) {
      return List.of();
    }
    int idx = dataset.indexOf(columnName);
    if (idx < 0) {
      return List.of();
    }
    String target = CellText.strip(value);
    return dataset.rows().stream()
        .filter(row -> CellText.strip(row.get(idx)).equals(target))
        .toList();
  }
}
