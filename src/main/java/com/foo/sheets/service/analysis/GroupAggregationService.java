package com.foo.sheets.service.analysis;

import com.foo.sheets.model.GroupMetric;
import com.foo.sheets.model.Reducer;
import com.foo.sheets.model.SheetDataset;
import com.foo.sheets.util.NumericCellParser;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class GroupAggregationService {

  private static final Comparator<GroupMetric> BY_GROUP_IGNORE_CASE =
      Comparator.comparing(m -> m.group().toLowerCase(Locale.ROOT));

  /**
   * 그룹 컬럼 값(원문 그대로, 대소문자 구분)으로 행을 묶고 집계 컬럼 값을 reducer 로 줄인다. 숫자가 아닌
   * 값은 0.0 으로 계산한다. 컬럼이 없으면 빈 리스트.
   */
  public List<GroupMetric> groupAndAggregate(SheetDataset dataset, String groupByColumn,
      String aggregateColumn, Reducer reducer) {
    int groupIdx = dataset.indexOf(groupByColumn);
    int valueIdx = dataset.indexOf(aggregateColumn);
    if (groupIdx < 0 || valueIdx < 0) {
      return List.of();
    }

    Map<String, List<Double>> buckets = new LinkedHashMap<>();
    for (List<String> row : dataset.rows()) {
      buckets.computeIfAbsent(row.get(groupIdx), k -> new ArrayList<>())
          .add(NumericCellParser.parseOrZero(row.get(valueIdx)));
    }

    List<GroupMetric> results = new ArrayList<>(buckets.size());
    buckets.forEach((group, values) -> results.add(new GroupMetric(group, reducer.reduce(values))));
    // 안정 정렬: 대소문자만 다른 그룹은 처음 등장한 순서를 유지
    results.sort(BY_GROUP_IGNORE_CASE);
    return results;
  }

  public List<GroupMetric> groupAndAggregate(SheetDataset dataset, String groupByColumn,
      String aggregateColumn, String agg) {
    return groupAndAggregate(dataset, groupByColumn, aggregateColumn, Reducer.fromTag(agg));
  }
}
