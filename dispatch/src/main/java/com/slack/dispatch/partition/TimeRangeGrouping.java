package com.slack.dispatch.partition;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups the files of one worker so that no two files of a group cover overlapping time ranges.
 * A group can then be scanned as a single time-ordered sequence.
 */
public class TimeRangeGrouping {

  private TimeRangeGrouping() {}

  /**
   * Files are taken by ascending max timestamp and each one joins the first group whose last file
   * ends strictly before it starts, or opens a new group. When that yields fewer than {@code
   * targetGroups} groups, the largest groups are split until the target is reached or no group has
   * more than one file.
   */
  public static List<List<FileKey>> group(List<FileKey> files, int targetGroups) {
    checkArgument(targetGroups >= 0, "targetGroups can't be negative");
    List<FileKey> sorted = new ArrayList<>(files);
    sorted.sort(Comparator.<FileKey>comparingLong(file -> file.maxTs).thenComparingLong(f -> f.id));

    List<List<FileKey>> groups = new ArrayList<>();
    for (FileKey file : sorted) {
      List<FileKey> target = null;
      for (List<FileKey> group : groups) {
        if (file.minTs > group.get(group.size() - 1).maxTs) {
          target = group;
          break;
        }
      }
      if (target == null) {
        target = new ArrayList<>();
        groups.add(target);
      }
      target.add(file);
    }

    if (groups.size() >= targetGroups) {
      return groups;
    }
    return split(groups, targetGroups);
  }

  /** Splits the largest group into its even and odd positions until there are enough groups. */
  static List<List<FileKey>> split(List<List<FileKey>> groups, int targetGroups) {
    List<List<FileKey>> result = new ArrayList<>(groups);
    while (!result.isEmpty() && result.size() < targetGroups) {
      List<FileKey> largest = result.remove(largestGroupIndex(result));
      if (largest.size() <= 1) {
        result.add(largest);
        break;
      }

      List<FileKey> even = new ArrayList<>();
      List<FileKey> odd = new ArrayList<>();
      for (int i = 0; i < largest.size(); i++) {
        (i % 2 == 0 ? even : odd).add(largest.get(i));
      }
      result.add(odd);
      result.add(even);
    }
    return result;
  }

  /** Index of the first group with the most files. */
  static int largestGroupIndex(List<List<FileKey>> groups) {
    int largest = 0;
    for (int i = 1; i < groups.size(); i++) {
      if (groups.get(i).size() > groups.get(largest).size()) {
        largest = i;
      }
    }
    return largest;
  }
}
