package com.codeheadsystems.keyward.storage;

import java.util.List;
import java.util.Map;

/**
 * Result of re-encrypting the data directory under a new master password.
 *
 * @param rotated files now readable with the new password
 * @param failed  files left untouched, with the reason
 */
public record RotationReport(List<String> rotated, Map<String, String> failed) {

  public RotationReport {
    rotated = List.copyOf(rotated);
    failed = Map.copyOf(failed);
  }

  public boolean complete() {
    return failed.isEmpty();
  }
}
