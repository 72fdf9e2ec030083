package com.codeheadsystems.keyward.storage;

import java.util.List;
import java.util.Map;

/**
 * Result of an emergency wipe.
 *
 * @param deleted files overwritten and removed
 * @param failed  files that could not be removed, with the reason
 */
public record WipeReport(List<String> deleted, Map<String, String> failed) {

  public WipeReport {
    deleted = List.copyOf(deleted);
    failed = Map.copyOf(failed);
  }
}
