package com.aiusage.canonicalizer.service.classification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.model.RankedResponse;
import com.aiusage.canonicalizer.service.normalization.CellText;

/**
 * Most frequent raw responses of a free-text column. Responses are grouped by their case-folded
 * trimmed form and shown with the spelling seen first; ties keep first-seen order.
 */
@Component
public class ResponseRanker {

  public List<RankedResponse> rank(List<Object> values, int limit) {
    Map<String, RankedResponse> grouped = new LinkedHashMap<>();
    for (Object value : values) {
      String text = CellText.of(value);
      if (CellText.isBlank(text)) {
        continue;
      }
      RankedResponse entry =
          grouped.computeIfAbsent(
              text.toLowerCase(Locale.ROOT),
              key -> RankedResponse.builder().text(text).count(0).build());
      entry.setCount(entry.getCount() + 1);
    }

    List<RankedResponse> ranked = new ArrayList<>(grouped.values());
    // List.sort is stable, equal counts stay in first-seen order
    ranked.sort(Comparator.comparingLong(RankedResponse::getCount).reversed());
    return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
  }
}
