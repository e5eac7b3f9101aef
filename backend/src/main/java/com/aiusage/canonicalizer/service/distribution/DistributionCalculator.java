package com.aiusage.canonicalizer.service.distribution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.model.CategoryCount;
import com.aiusage.canonicalizer.model.CategoryDistribution;

/**
 * Counts labels and converts the counts to percentages with one decimal place.
 *
 * <p>Rounding uses the largest remainder method on tenths of a percent: every share is floored,
 * then the tenths still missing from 100.0 go to the largest remainders, earlier labels first on
 * ties. A non-empty distribution therefore always totals exactly 100.0.
 */
@Component
public class DistributionCalculator {

  private static final long TOTAL_TENTHS = 1000L;

  /**
   * @param assigned one label per row
   * @param declaredOrder labels listed first, zero-filled when absent; labels seen in {@code
   *     assigned} but not declared follow in first-seen order
   */
  public CategoryDistribution calculate(List<String> assigned, List<String> declaredOrder) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (String label : declaredOrder) {
      counts.putIfAbsent(label, 0L);
    }
    for (String label : assigned) {
      counts.merge(label, 1L, Long::sum);
    }

    long total = assigned.size();
    List<String> labels = new ArrayList<>(counts.keySet());
    long[] tenths = new long[labels.size()];
    long[] remainders = new long[labels.size()];
    long distributed = 0;

    for (int i = 0; i < labels.size(); i++) {
      long count = counts.get(labels.get(i));
      if (total > 0) {
        tenths[i] = count * TOTAL_TENTHS / total;
        remainders[i] = count * TOTAL_TENTHS % total;
        distributed += tenths[i];
      }
    }

    if (total > 0) {
      List<Integer> byRemainder = new ArrayList<>();
      for (int i = 0; i < labels.size(); i++) {
        byRemainder.add(i);
      }
      byRemainder.sort(Comparator.comparingLong((Integer i) -> remainders[i]).reversed());
      long leftover = TOTAL_TENTHS - distributed;
      for (int i = 0; i < byRemainder.size() && leftover > 0; i++) {
        tenths[byRemainder.get(i)]++;
        leftover--;
      }
    }

    List<CategoryCount> entries = new ArrayList<>(labels.size());
    for (int i = 0; i < labels.size(); i++) {
      entries.add(
          CategoryCount.builder()
              .label(labels.get(i))
              .count(counts.get(labels.get(i)))
              .percentage(tenths[i] / 10.0)
              .build());
    }

    return CategoryDistribution.builder().total(total).entries(entries).build();
  }
}
