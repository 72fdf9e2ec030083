package com.codeheadsystems.keyward.keys;

/**
 * Identity of a freshly generated key pair.
 *
 * @param fingerprint grouped fingerprint, the ring key
 * @param keyId       display id
 */
public record KeyGenerationResult(String fingerprint, String keyId) {
}
