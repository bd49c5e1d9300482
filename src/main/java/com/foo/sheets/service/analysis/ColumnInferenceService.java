package com.foo.sheets.service.analysis;

import com.foo.sheets.config.SheetSourceProperties;
import com.foo.sheets.model.ColumnSelection;
import com.foo.sheets.model.SheetDataset;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 힌트 없이 기본 (그룹 컬럼, 집계 컬럼) 쌍을 고른다.
 *
 * <ul>
 *   <li>집계 컬럼: 숫자 비율이 0.5 이상인 컬럼 중 최대. 같은 비율이면 뒤의 컬럼이 이긴다.
 *   <li>그룹 컬럼: 숫자 비율이 0.5 미만이고 서로 다른 값이 2~50개인 첫 번째 컬럼.
 * </ul>
 *
 * 두 규칙의 동점 처리는 서로 다르다. 하나의 스캔으로 합치면 동점 입력의 결과가 바뀐다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnInferenceService {

  static final double NUMERIC_THRESHOLD = 0.5;
  static final int MIN_GROUP_CARDINALITY = 2;
  static final int MAX_GROUP_CARDINALITY = 50;

  private final SheetSourceProperties properties;

  public ColumnSelection inferDefaultColumns(SheetDataset dataset) {
    if (dataset.hasNoData()) {
      return ColumnSelection.none();
    }

    List<ColumnStatistics> stats =
        ColumnStatistics.allColumns(dataset, properties.getSampleSize());

    int aggregateIdx = mostNumericColumn(stats);
    int groupByIdx = firstGroupableColumn(stats);

    if (groupByIdx < 0) {
      groupByIdx = 0;
    }
    if (aggregateIdx < 0) {
      aggregateIdx = dataset.columnCount() > 1 ? 1 : 0;
    }

    log.debug("Inferred columns: groupBy={} aggregate={}", groupByIdx, aggregateIdx);
    List<String> headers = dataset.headers();
    return new ColumnSelection(headers.get(groupByIdx), headers.get(aggregateIdx));
  }

  /** 비율이 같으면 나중 컬럼으로 갱신된다 (>=). 없으면 -1. */
  static int mostNumericColumn(List<ColumnStatistics> stats) {
    int bestIdx = -1;
    double bestRatio = NUMERIC_THRESHOLD;
    for (ColumnStatistics stat : stats) {
      if (stat.numericRatio() >= bestRatio) {
        bestRatio = stat.numericRatio();
        bestIdx = stat.columnIndex();
      }
    }
    return bestIdx;
  }

  private int firstGroupableColumn(List<ColumnStatistics> stats) {
    for (ColumnStatistics stat : stats) {
      if (stat.numericRatio() < NUMERIC_THRESHOLD
          && stat.cardinality() >= MIN_GROUP_CARDINALITY
          && stat.cardinality() <= MAX_GROUP_CARDINALITY) {
        return stat.columnIndex();
      }
    }
    return -1;
  }
}
