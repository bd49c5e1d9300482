package com.foo.sheets.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.sheets.model.GroupMetric;
import com.foo.sheets.model.Reducer;
import com.foo.sheets.model.SheetDataset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GroupAggregationServiceTest {

  private static final SheetDataset PROGRAMS = new SheetDataset(
      List.of("Program", "Company", "CBR (%)"),
      List.of(
          List.of("A", "X", "10%"),
          List.of("A", "Y", "20%"),
          List.of("B", "Z", "abc")));

  private GroupAggregationService aggregationService;

  @BeforeEach
  void setUp() {
    aggregationService = new GroupAggregationService();
  }

  @Test
  void avg_nonNumericCountsAsZero() {
    List<GroupMetric> result =
        aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "avg");

    assertThat(result).containsExactly(new GroupMetric("A", 15.0), new GroupMetric("B", 0.0));
  }

  @Test
  void count_includesNonNumericRows() {
    List<GroupMetric> result =
        aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", Reducer.COUNT);

    assertThat(result).containsExactly(new GroupMetric("A", 2.0), new GroupMetric("B", 1.0));
  }

  @Test
  void sumMinMax() {
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "sum"))
        .containsExactly(new GroupMetric("A", 30.0), new GroupMetric("B", 0.0));
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "min"))
        .containsExactly(new GroupMetric("A", 10.0), new GroupMetric("B", 0.0));
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "max"))
        .containsExactly(new GroupMetric("A", 20.0), new GroupMetric("B", 0.0));
  }

  @Test
  void unknownReducer_behavesAsSum() {
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "median"))
        .isEqualTo(aggregationService.groupAndAggregate(PROGRAMS, "Program", "CBR (%)", "sum"));
  }

  @Test
  void unknownColumn_returnsEmpty() {
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Missing", "CBR (%)", "sum"))
        .isEmpty();
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, "Program", "Missing", "sum"))
        .isEmpty();
    assertThat(aggregationService.groupAndAggregate(PROGRAMS, null, null, "sum")).isEmpty();
  }

  @Test
  void groups_areCaseSensitiveButSortedIgnoringCase() {
    SheetDataset dataset = new SheetDataset(
        List.of("Team", "Points"),
        List.of(
            List.of("beta", "1"),
            List.of("Alpha", "2"),
            List.of("alpha", "3"),
            List.of("Beta", "4"),
            List.of("a lpha", "5")));

    List<GroupMetric> result =
        aggregationService.groupAndAggregate(dataset, "Team", "Points", "sum");

    assertThat(result).extracting(GroupMetric::group)
        .containsExactly("a lpha", "Alpha", "alpha", "beta", "Beta");
  }

  @Test
  void groupLabels_areExactlyDistinctValues_andResultIsDeterministic() {
    SheetDataset dataset = new SheetDataset(
        List.of("Region", "Sales"),
        List.of(
            List.of("East", "1,000"),
            List.of("West", "250"),
            List.of("", "5"),
            List.of("East", "500")));

    List<GroupMetric> first =
        aggregationService.groupAndAggregate(dataset, "Region", "Sales", "sum");
    List<GroupMetric> second =
        aggregationService.groupAndAggregate(dataset, "Region", "Sales", "sum");

    assertThat(first).isEqualTo(second);
    assertThat(first).containsExactly(
        new GroupMetric("", 5.0), new GroupMetric("East", 1500.0), new GroupMetric("West", 250.0));
  }
}
