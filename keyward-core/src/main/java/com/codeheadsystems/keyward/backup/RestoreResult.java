package com.codeheadsystems.keyward.backup;

/**
 * Counts from restoring a backup.
 *
 * @param importedPublic  public keys imported
 * @param importedPrivate private keys imported
 * @param failed          entries that could not be imported
 */
public record RestoreResult(int importedPublic, int importedPrivate, int failed) {
}
