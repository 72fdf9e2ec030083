package com.codeheadsystems.keyward.backup;

/**
 * A sealed backup and what went into it.
 *
 * @param encryptedBackup base64 of salt || sealed token
 * @param publicKeys      public keys included
 * @param privateKeys     private keys included
 * @param skipped         private keys left out because they did not unlock with the passphrase
 */
public record BackupResult(String encryptedBackup, int publicKeys, int privateKeys, int skipped) {
}
