package com.foo.sheets.model;

import java.util.Arrays;
import java.util.List;

public enum Reducer {
  SUM("sum"),
  COUNT("count"),
  AVG("avg"),
  MIN("min"),
  MAX("max");

  private final String tag;

  Reducer(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /** 알 수 없는 태그(null 포함)는 SUM 으로 처리한다. */
  public static Reducer fromTag(String tag) {
    return Arrays.stream(values())
        .filter(r -> r.tag.equals(tag))
        .findFirst()
        .orElse(SUM);
  }

  public double reduce(List<Double> values) {
    if (values.isEmpty()) {
      return 0.0;
    }
    return switch (this) {
      case COUNT -> values.size();
      case AVG -> sum(values) / values.size();
      case MIN -> extremum(values, true);
      case MAX -> extremum(values, false);
      case SUM -> sum(values);
    };
  }

  // 보정 없는 순차 합산. DoubleStream.sum 과 결과 비트가 다를 수 있다
  private static double sum(List<Double> values) {
    double total = 0.0;
    for (double v : values) {
      total += v;
    }
    return total;
  }

  private static double extremum(List<Double> values, boolean min) {
    double best = values.get(0);
    for (int i = 1; i < values.size(); i++) {
      double v = values.get(i);
      if (min ? v < best : v > best) {
        best = v;
      }
    }
    return best;
  }
}
