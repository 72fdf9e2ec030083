package com.codeheadsystems.keyward.storage;

import java.util.List;
import java.util.Map;

/**
 * Result of sweeping a directory for plaintext files.
 *
 * @param migrated files rewritten in encrypted form
 * @param failed   files that could not be migrated, with the reason
 */
public record MigrationReport(List<String> migrated, Map<String, String> failed) {

  public MigrationReport {
    migrated = List.copyOf(migrated);
    failed = Map.copyOf(failed);
  }

  public boolean clean() {
    return failed.isEmpty();
  }
}
