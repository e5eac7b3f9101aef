package com.aiusage.canonicalizer.service.canonicalization;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Makes proposed column names unique. The first occurrence of a name keeps it; later duplicates
 * get {@code _2}, {@code _3}, ... skipping any suffixed name that is already taken.
 */
@Slf4j
@Component
public class CollisionResolver {

  static final int FIRST_SUFFIX = 2;

  public List<String> resolve(List<String> proposedNames) {
    Set<String> used = new HashSet<>();
    List<String> resolved = new ArrayList<>(proposedNames.size());

    for (String proposed : proposedNames) {
      String name = proposed;
      if (used.contains(name)) {
        int suffix = FIRST_SUFFIX;
        while (used.contains(proposed + "_" + suffix)) {
          suffix++;
        }
        name = proposed + "_" + suffix;
        log.debug("Column name '{}' already used, renamed to '{}'", proposed, name);
      }
      used.add(name);
      resolved.add(name);
    }

    return resolved;
  }
}
