package com.slack.dispatch.partition;

import static com.slack.dispatch.testlib.DispatchTestUtil.ORG;
import static com.slack.dispatch.testlib.DispatchTestUtil.STREAM;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TimeRangeGroupingTest {

  @Test
  public void testDisjointFilesAreSplitToTarget() {
    List<FileKey> files =
        List.of(file(1, 10), file(11, 20), file(21, 30), file(31, 40), file(41, 50));

    List<List<FileKey>> groups = TimeRangeGrouping.group(files, 3);

    assertThat(groups).hasSize(3);
    assertCoversWithoutOverlap(groups, files);
  }

  @Test
  public void testOverlappingFilesLandInDifferentGroups() {
    List<FileKey> files =
        List.of(
            file(1, 10), file(5, 15), file(11, 20), file(18, 30), file(31, 40), file(41, 50));

    List<List<FileKey>> groups = TimeRangeGrouping.group(files, 2);

    assertThat(groups).hasSize(2);
    assertThat(groups.get(0)).extracting(file -> file.minTs).containsExactly(1L, 11L, 31L, 41L);
    assertThat(groups.get(1)).extracting(file -> file.minTs).containsExactly(5L, 18L);
    assertCoversWithoutOverlap(groups, files);
  }

  @Test
  public void testInputOrderDoesNotMatter() {
    List<FileKey> files = new ArrayList<>(List.of(file(41, 50), file(5, 15), file(1, 10)));

    assertThat(TimeRangeGrouping.group(files, 0))
        .isEqualTo(TimeRangeGrouping.group(List.of(file(1, 10), file(5, 15), file(41, 50)), 0));
  }

  @Test
  public void testSingleFileGroupsAreNotSplit() {
    List<FileKey> files = List.of(file(1, 10), file(11, 20));

    List<List<FileKey>> groups = TimeRangeGrouping.group(files, 3);

    assertThat(groups).hasSize(2);
    assertCoversWithoutOverlap(groups, files);
  }

  @Test
  public void testNoFilesMakeNoGroups() {
    assertThat(TimeRangeGrouping.group(List.of(), 4)).isEmpty();
  }

  @Test
  public void testSplitReachesTarget() {
    List<List<FileKey>> groups =
        List.of(List.of(file(1, 10), file(11, 20)), List.of(file(21, 30), file(31, 40)));

    assertThat(TimeRangeGrouping.split(groups, 4)).hasSize(4).allMatch(group -> group.size() == 1);
  }

  @Test
  public void testSplitAlternatesFilesOfLargeGroup() {
    List<FileKey> files =
        List.of(file(1, 10), file(11, 20), file(21, 30), file(31, 40), file(41, 50));

    List<List<FileKey>> groups = TimeRangeGrouping.split(List.of(files), 3);

    assertThat(groups).hasSize(3);
    // odd positions first, then the even positions split again
    assertThat(groups.get(0)).containsExactly(file(11, 20), file(31, 40));
    assertThat(groups.get(1)).containsExactly(file(21, 30));
    assertThat(groups.get(2)).containsExactly(file(1, 10), file(41, 50));
  }

  @Test
  public void testLargestGroupIndex() {
    List<List<FileKey>> groups =
        List.of(
            List.of(file(1, 10)),
            List.of(file(11, 20), file(21, 30)),
            List.of(file(31, 40)),
            List.of(file(41, 50), file(51, 60)));

    assertThat(TimeRangeGrouping.largestGroupIndex(groups)).isEqualTo(1);
  }

  private static FileKey file(long minTs, long maxTs) {
    return FileKey.withTimeRange(minTs, ORG, STREAM, minTs, maxTs);
  }

  private static void assertCoversWithoutOverlap(
      List<List<FileKey>> groups, List<FileKey> files) {
    assertThat(groups.stream().flatMap(List::stream).toList())
        .containsExactlyInAnyOrderElementsOf(files);
    for (List<FileKey> group : groups) {
      assertThat(group).isNotEmpty();
      for (int i = 1; i < group.size(); i++) {
        assertThat(group.get(i).minTs).isGreaterThan(group.get(i - 1).maxTs);
      }
    }
  }
}
