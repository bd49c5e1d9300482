package com.foo.sheets.service.analysis;

import com.foo.sheets.config.SheetSourceProperties;
import com.foo.sheets.model.SheetDataset;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricColumnSelector {

  private final SheetSourceProperties properties;

  public Optional<String> findBestMetricColumn(SheetDataset dataset) {
    return findBestMetricColumn(dataset, properties.getPreferredMetricColumns());
  }

  /**
   * 선호 목록에서 헤더에 있고 숫자 비율이 0.5 이상인 첫 이름을 고른다. 없으면 가장 숫자다운 컬럼.
   */
  public Optional<String> findBestMetricColumn(SheetDataset dataset, List<String> preferredNames) {
    if (dataset.hasNoData()) {
      return Optional.empty();
    }
    int sampleSize = properties.getSampleSize();

    if (preferredNames != null) {
      for (String name : preferredNames) {
        int idx = dataset.indexOf(name);
        if (idx >= 0
            && ColumnStatistics.of(dataset, idx, sampleSize).numericRatio()
                >= ColumnInferenceService.NUMERIC_THRESHOLD) {
          log.debug("Preferred metric column '{}' selected", name);
          return Optional.of(name);
        }
      }
    }

    int bestIdx =
        ColumnInferenceService.mostNumericColumn(ColumnStatistics.allColumns(dataset, sampleSize));
    return bestIdx < 0 ? Optional.empty() : Optional.of(dataset.headers().get(bestIdx));
  }
}
