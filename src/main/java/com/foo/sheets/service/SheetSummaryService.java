package com.foo.sheets.service;

import com.foo.sheets.config.SheetSourceProperties;
import com.foo.sheets.model.ColumnSelection;
import com.foo.sheets.model.GroupMetric;
import com.foo.sheets.model.Reducer;
import com.foo.sheets.model.SheetDataset;
import com.foo.sheets.service.analysis.ColumnInferenceService;
import com.foo.sheets.service.analysis.GroupAggregationService;
import com.foo.sheets.service.analysis.MetricColumnSelector;
import com.foo.sheets.service.analysis.RowFilterService;
import com.foo.sheets.service.fetch.SheetFetchService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SheetSummaryService {

  private final SheetFetchService fetchService;
  private final ColumnInferenceService inferenceService;
  private final MetricColumnSelector metricColumnSelector;
  private final GroupAggregationService aggregationService;
  private final RowFilterService rowFilterService;
  private final SheetSourceProperties properties;

  @Builder
  public record SheetSummary(
      List<String> headers,
      int rowCount,
      String groupBy,
      String aggregate,
      String agg,
      List<GroupMetric> results) {}

  @Builder
  public record FilteredRows(
      List<String> headers, String column, String value, List<List<String>> rows) {}

  public SheetSummary summarize(SheetQuery query, String groupBy, String aggregate, String agg) {
    SheetDataset dataset = fetch(query);
    Reducer reducer = Reducer.fromTag(agg);

    String resolvedGroupBy = groupBy;
    String resolvedAggregate = aggregate;
    if (isEmpty(resolvedAggregate)) {
      resolvedAggregate = metricColumnSelector.findBestMetricColumn(dataset).orElse(null);
    }
    if (isEmpty(resolvedGroupBy) || isEmpty(resolvedAggregate)) {
      ColumnSelection inferred = inferenceService.inferDefaultColumns(dataset);
      if (isEmpty(resolvedGroupBy)) {
        resolvedGroupBy = inferred.groupByColumn();
      }
      if (isEmpty(resolvedAggregate)) {
        resolvedAggregate = inferred.aggregateColumn();
      }
    }

    List<GroupMetric> results =
        aggregationService.groupAndAggregate(dataset, resolvedGroupBy, resolvedAggregate, reducer);
    log.debug("Summarized by '{}' over '{}' ({}): {} groups",
        resolvedGroupBy, resolvedAggregate, reducer.getTag(), results.size());

    return SheetSummary.builder()
        .headers(dataset.headers())
        .rowCount(dataset.rowCount())
        .groupBy(resolvedGroupBy)
        .aggregate(resolvedAggregate)
        .agg(reducer.getTag())
        .results(results)
        .build();
  }

  public FilteredRows filter(SheetQuery query, String column, String value) {
    SheetDataset dataset = fetch(query);
    return FilteredRows.builder()
        .headers(dataset.headers())
        .column(column)
        .value(value)
        .rows(rowFilterService.filterRowsByValue(dataset, column, value))
        .build();
  }

  public Map<String, Object> toApiResponse(SheetSummary summary) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", true);
    response.put("headers", summary.headers());
    response.put("rowCount", summary.rowCount());
    response.put("groupBy", summary.groupBy());
    response.put("aggregate", summary.aggregate());
    response.put("agg", summary.agg());
    response.put("results", summary.results());
    return response;
  }

  public Map<String, Object> toApiResponse(FilteredRows filtered) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", true);
    response.put("headers", filtered.headers());
    response.put("column", filtered.column());
    response.put("value", filtered.value());
    response.put("rowCount", filtered.rows().size());
    response.put("rows", filtered.rows());
    return response;
  }

  private SheetDataset fetch(SheetQuery query) {
    SheetQuery resolved = query.withDefaults(properties);
    if (isEmpty(resolved.sheetId())) {
      throw new IllegalArgumentException("sheetId 는 필수입니다.");
    }
    return fetchService.fetch(
        resolved.sheetId(), resolved.sheetName(), resolved.gid(), resolved.timeoutSeconds());
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
